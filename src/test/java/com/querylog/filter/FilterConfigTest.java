package com.querylog.filter;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FilterConfigTest {

    private static Properties load(String resource) throws IOException {
        Properties props = new Properties();
        try (InputStream in = FilterConfigTest.class.getResourceAsStream(resource)) {
            props.load(in);
        }
        return props;
    }

    @Test
    public void testDefaultPatterns() {
        FilterConfig config = new FilterConfig();

        assertTrue(config.shouldIgnore("SET NAMES UTF8"));
        assertTrue(config.shouldIgnore("SET AUTOCOMMIT=0"));
        assertTrue(config.shouldIgnore("SELECT @@TX_ISOLATION"));
        assertTrue(config.shouldIgnore("SHOW FULL PROCESSLIST"));
        assertTrue(config.shouldIgnore("USE SHOP"));
        assertTrue(config.shouldIgnore("LOCK TABLES T WRITE"));
        assertFalse(config.shouldIgnore("SELECT * FROM SHOWROOM"));
        // patterns are anchored at the start only
        assertFalse(config.shouldIgnore("SELECT 1; COMMIT"));
    }

    @Test
    public void testLoadFromProperties() throws IOException {
        FilterConfig config = new FilterConfig();
        config.loadFromProperties(load("/filter-test.properties"));

        assertFalse(config.getPatternNames().contains("show"));
        assertTrue(config.getPatternNames().contains("iotlog"));
        assertFalse(config.shouldIgnore("SHOW TABLES"));
        assertTrue(config.shouldIgnore("SET NAMES UTF8"));
        assertTrue(config.shouldIgnore("UPDATE IOTLOG SET FULLREPORT = 'X' WHERE ID = 1"));
        assertTrue(config.shouldIgnore("INSERT INTO LOGIN.SESSIONS (IDLOGIN,SESSION,DATESESSION) VALUES (1, 'A', NOW())"));
        assertTrue(config.shouldIgnore("SELECT @@SESSION.AUTO_INCREMENT_INCREMENT AS AUTO_INCREMENT_INCREMENT, "
                + "@@CHARACTER_SET_CLIENT AS CHARACTER_SET_CLIENT, @@CHARACTER_SET_CONNECTION"));
    }

    @Test
    public void testDefaultsCanBeDisabled() {
        Properties props = new Properties();
        props.setProperty("filter.ignore.defaults", "false");
        props.setProperty("filter.ignore.heartbeat", "SELECT 1$");

        FilterConfig config = new FilterConfig();
        config.loadFromProperties(props);

        assertEquals(1, config.getPatternNames().size());
        assertFalse(config.shouldIgnore("SET NAMES UTF8"));
        assertTrue(config.shouldIgnore("SELECT 1"));
        assertFalse(config.shouldIgnore("SELECT 10"));
    }

    @Test
    public void testExclusions() {
        FilterConfig config = new FilterConfig();
        config.addExclusion(sql -> sql.contains("FROM MONITORING."));

        assertTrue(config.shouldIgnore("SELECT COUNT(*) FROM MONITORING.PROBES"));
        assertFalse(config.shouldIgnore("SELECT COUNT(*) FROM SHOP.ORDERS"));

        config.removePattern("commit");
        assertFalse(config.shouldIgnore("COMMIT"));
    }
}
