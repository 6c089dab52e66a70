package com.querylog.parser;

import java.io.FileWriter;
import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.querylog.parser.accumulator.Template;
import com.querylog.parser.accumulator.UserStats;

/**
 * Generates a structured JSON report from a finished {@link QueryLogProcessor}
 */
public class JsonReportGenerator {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static void generateReport(String fileName, QueryLogProcessor processor) throws IOException {
        ObjectNode report = generateReportJson(processor);
        try (FileWriter writer = new FileWriter(fileName)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, report);
        }
    }

    public static ObjectNode generateReportJson(QueryLogProcessor processor) {
        ParserOptions options = processor.getOptions();
        ObjectNode report = mapper.createObjectNode();

        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("generatedAt", java.time.Instant.now().toString());
        metadata.put("earliestTimestamp", processor.getEarliestTimestamp());
        metadata.put("latestTimestamp", processor.getLatestTimestamp());
        metadata.put("mode", options.isCoarse() ? "coarse" : "fine");
        if (!options.isCoarse()) {
            metadata.put("threshold", options.getThreshold());
        }
        if (options.getBreakoff() != null) {
            metadata.put("breakoff", options.getBreakoff());
            metadata.put("breakoffReached", processor.isHalted());
        }
        report.set("metadata", metadata);

        ObjectNode lines = mapper.createObjectNode();
        lines.put("read", processor.getLineCount());
        lines.put("ignored", processor.getIgnoredCount());
        lines.put("unparsed", processor.getUnparsedCount());
        lines.put("droppedUnknownConnection", processor.getDroppedCount());
        report.set("lines", lines);

        ArrayNode users = mapper.createArrayNode();
        for (UserStats stats : processor.getAccumulator().getSortedUsers()) {
            users.add(generateUserJson(stats, options.isCoarse()));
        }
        report.set("users", users);
        return report;
    }

    private static ObjectNode generateUserJson(UserStats stats, boolean coarse) {
        ObjectNode user = mapper.createObjectNode();
        user.put("user", stats.getUser());
        user.put("connections", stats.getConnectionCount());
        user.put("queries", stats.getQueryCount());

        ObjectNode verbs = mapper.createObjectNode();
        for (Verb verb : Verb.values()) {
            verbs.put(verb.getType(), stats.getVerbCount(verb));
        }
        user.set("verbs", verbs);

        if (coarse) {
            return user;
        }

        ArrayNode templates = mapper.createArrayNode();
        for (Template template : stats.getTemplates().byDescendingCount()) {
            ObjectNode t = mapper.createObjectNode();
            t.put("count", template.getCount());
            t.put("template", template.getText());
            templates.add(t);
        }
        user.set("templates", templates);

        ObjectNode merges = mapper.createObjectNode();
        merges.put("count", stats.getMergeCount());
        merges.put("meanDistance", stats.getMeanMergeDistance());
        merges.put("p95Distance", stats.getMergeDistancePercentile95());
        user.set("merges", merges);
        return user;
    }
}
