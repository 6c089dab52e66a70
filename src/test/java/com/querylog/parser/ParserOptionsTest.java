package com.querylog.parser;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.querylog.parser.SqlMangler.MangleRule;

import static org.junit.jupiter.api.Assertions.*;

public class ParserOptionsTest {

    @Test
    public void testBreakoffIsZeroPadded() {
        assertEquals("2017-02-03", ParserOptions.normalizeBreakoff("2017-2-3"));
        assertEquals("2018-01-01", ParserOptions.normalizeBreakoff("2018-01-01"));
    }

    @Test
    public void testImpossibleDatesRollOver() {
        assertEquals("2017-03-01", ParserOptions.normalizeBreakoff("2017-02-29"));
        assertEquals("2017-05-01", ParserOptions.normalizeBreakoff("2017-04-31"));
    }

    @Test
    public void testMalformedBreakoff() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ParserOptions.normalizeBreakoff("2017/02/03"));
        assertEquals("The argument to breakoff should be a date formatted like YYYY-MM-DD", e.getMessage());

        assertThrows(IllegalArgumentException.class, () -> ParserOptions.normalizeBreakoff("17-02-03"));
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.normalizeBreakoff("yesterday"));
        assertThrows(IllegalArgumentException.class, () -> ParserOptions.normalizeBreakoff(null));
    }

    @Test
    public void testRangeChecks() {
        ParserOptions options = new ParserOptions();
        assertThrows(IllegalArgumentException.class, () -> options.setThreshold(0.0));
        assertThrows(IllegalArgumentException.class, () -> options.setThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> options.setThreads(0));

        options.setThreshold(1.0);
        assertEquals(1.0, options.getThreshold());
    }

    @Test
    public void testDefaults() {
        ParserOptions options = new ParserOptions();
        assertFalse(options.isCoarse());
        assertNull(options.getBreakoff());
        assertEquals(0.15, options.getThreshold());
        assertEquals(1, options.getThreads());
        assertEquals(SqlMangler.defaultRules(), options.getMangleRules());
    }

    @Test
    public void testLoadFromProperties() throws IOException {
        Properties props = new Properties();
        try (InputStream in = getClass().getResourceAsStream("/filter-test.properties")) {
            props.load(in);
        }
        ParserOptions options = new ParserOptions();
        options.loadFromProperties(props);

        assertEquals(0.1, options.getThreshold());
        List<MangleRule> rules = options.getMangleRules();
        assertEquals("uuid", rules.get(rules.size() - 1).getName());
        assertTrue(options.getFilterConfig().shouldIgnore("UPDATE IOTLOG SET FULLREPORT = 'X' WHERE ID = 1"));

        SqlMangler mangler = new SqlMangler(rules);
        assertEquals("SELECT * FROM T WHERE U = '~UUID~'",
                mangler.mangle("SELECT * FROM T WHERE U = 'ABCDEF12-0000-1111-2222-333344445555'"));
    }

    @Test
    public void testInvalidThresholdProperty() {
        Properties props = new Properties();
        props.setProperty("cluster.threshold", "tight");

        assertThrows(IllegalArgumentException.class, () -> new ParserOptions().loadFromProperties(props));
    }
}
