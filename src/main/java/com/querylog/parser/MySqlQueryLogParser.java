package com.querylog.parser;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Reads a MySQL 5.6 general query log and reports, per user, how many
 * connections and queries were seen, and (unless coarse) which statement
 * templates the queries fall into.
 */
@Command(name = "mysqlQueryLogParser", mixinStandardHelpOptions = true, version = "1.0",
         description = "Build per-user query statistics from a MySQL 5.6 general query log, read from the given files or standard input")
public class MySqlQueryLogParser implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(MySqlQueryLogParser.class);

    private static final int BUFFER_SIZE = 16 * 1024 * 1024;

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "General query log file(s), plain or .gz")
    private List<File> files = new ArrayList<>();

    @Option(names = { "--verbose" }, description = "Log captured statements, connections and template matches")
    private boolean verbose = false;

    @Option(names = { "--coarse" }, description = "Only count queries per user instead of grouping them into templates")
    private boolean coarse = false;

    @Option(names = { "--breakoff" }, paramLabel = "YYYY-MM-DD", description = "Stop reading once the log reaches this date")
    private String breakoff;

    @Option(names = { "--config" }, description = "Properties file with filter patterns, mangling rules and cluster.threshold")
    private File configFile;

    @Option(names = { "--threshold" }, description = "Normalized edit distance below which a statement joins a template (default: 0.15)")
    private Double threshold;

    @Option(names = { "--threads" }, description = "Clustering worker threads (default: 1, clustering inline)")
    private int threads = 1;

    @Option(names = { "--json" }, description = "JSON output file for the report")
    private String jsonOutputFile;

    @Override
    public Integer call() throws Exception {
        ParserOptions options;
        try {
            options = buildOptions();
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        if (options.isVerbose()) {
            enableVerboseLogging();
        }

        try (QueryLogProcessor processor = new QueryLogProcessor(options)) {
            try {
                int successfulInputs = read(processor);
                if (successfulInputs == 0) {
                    logger.error("No input was successfully processed, no report generated");
                    return 1;
                }
                processor.finish();
            } catch (ParserStateException e) {
                logger.error("Fatal parser state at line {} '{}': {}", e.getLineNumber(), e.getLine(),
                        e.getMessage(), e);
                return 2;
            }

            processor.getAccumulator().report(System.out, options.isCoarse());
            System.out.flush();

            if (jsonOutputFile != null) {
                JsonReportGenerator.generateReport(jsonOutputFile, processor);
                logger.info("JSON report written to {}", jsonOutputFile);
            }
        }
        return 0;
    }

    ParserOptions buildOptions() {
        ParserOptions options = new ParserOptions();
        options.setVerbose(verbose);
        options.setCoarse(coarse);
        if (configFile != null) {
            loadConfiguration(options);
        }
        if (breakoff != null) {
            options.setBreakoff(breakoff);
            System.err.println("Breakoff is now " + options.getBreakoff());
        }
        if (threshold != null) {
            options.setThreshold(threshold);
        }
        options.setThreads(threads);
        return options;
    }

    private void loadConfiguration(ParserOptions options) {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configFile)) {
            props.load(in);
        } catch (IOException e) {
            logger.warn("Could not load config file: {}. Using defaults.", configFile);
            return;
        }
        options.loadFromProperties(props);
        logger.info("Loaded configuration from: {}", configFile);
    }

    int read(QueryLogProcessor processor) throws IOException, InterruptedException {
        if (files.isEmpty()) {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8), BUFFER_SIZE);
            processor.process(in);
            return 1;
        }

        int successfulFiles = 0;
        for (File f : files) {
            if (!f.exists()) {
                logger.error("File not found: {}", f);
                continue;
            }
            if (!f.canRead()) {
                logger.error("Cannot read file: {}", f);
                continue;
            }
            logger.info("Processing {} ({} bytes)", f.getName(), f.length());
            boolean more;
            try (BufferedReader in = createReader(f)) {
                more = processor.process(in);
            }
            successfulFiles++;
            if (!more) {
                break;
            }
        }
        return successfulFiles;
    }

    static BufferedReader createReader(File file) throws IOException {
        InputStream in = new FileInputStream(file);
        if (file.getName().endsWith(".gz")) {
            in = new GZIPInputStream(in);
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), BUFFER_SIZE);
    }

    private static void enableVerboseLogging() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.getLogger("com.querylog").setLevel(Level.DEBUG);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MySqlQueryLogParser()).execute(args);
        System.exit(exitCode);
    }
}
