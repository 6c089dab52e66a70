package com.querylog.parser;

import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

public class JsonReportGeneratorTest {

    @TempDir
    Path tempDir;

    private static QueryLogProcessor process(ParserOptions options) throws Exception {
        QueryLogProcessor processor = new QueryLogProcessor(options);
        try (BufferedReader in = new BufferedReader(new InputStreamReader(
                JsonReportGeneratorTest.class.getResourceAsStream("/logs/general-query.log"), StandardCharsets.UTF_8))) {
            processor.process(in);
        }
        processor.finish();
        processor.close();
        return processor;
    }

    @Test
    public void testFineReport() throws Exception {
        JsonNode report = JsonReportGenerator.generateReportJson(process(new ParserOptions()));

        JsonNode metadata = report.get("metadata");
        assertEquals("fine", metadata.get("mode").asText());
        assertEquals(0.15, metadata.get("threshold").asDouble());
        assertEquals("2017-12-15 10:00:00", metadata.get("earliestTimestamp").asText());
        assertFalse(metadata.has("breakoff"));

        assertEquals(22, report.get("lines").get("read").asLong());
        assertEquals(1, report.get("lines").get("droppedUnknownConnection").asLong());

        JsonNode users = report.get("users");
        assertEquals(2, users.size());
        JsonNode app = users.get(0);
        assertEquals("app@10.0.0.7", app.get("user").asText());
        assertEquals(4, app.get("queries").asLong());
        assertEquals(3, app.get("verbs").get("select").asLong());
        assertEquals(0, app.get("verbs").get("call").asLong());
        assertEquals(3, app.get("templates").get(0).get("count").asLong());
        assertEquals("INSERT INTO AUDIT VALUES ('~', '~IPv4~')", app.get("templates").get(1).get("template").asText());
        assertEquals(2, app.get("merges").get("count").asLong());
    }

    @Test
    public void testCoarseReportWithBreakoff() throws Exception {
        ParserOptions options = new ParserOptions();
        options.setCoarse(true);
        options.setBreakoff("2017-12-16");
        JsonNode report = JsonReportGenerator.generateReportJson(process(options));

        JsonNode metadata = report.get("metadata");
        assertEquals("coarse", metadata.get("mode").asText());
        assertFalse(metadata.has("threshold"));
        assertEquals("2017-12-16", metadata.get("breakoff").asText());
        assertTrue(metadata.get("breakoffReached").asBoolean());
        assertFalse(report.get("users").get(0).has("templates"));
    }

    @Test
    public void testReportIsWrittenToFile() throws Exception {
        File output = tempDir.resolve("report.json").toFile();
        JsonReportGenerator.generateReport(output.getPath(), process(new ParserOptions()));

        JsonNode written = new ObjectMapper().readTree(output);
        assertEquals(2, written.get("users").size());
        assertEquals("report@localhost", written.get("users").get(1).get("user").asText());
    }
}
