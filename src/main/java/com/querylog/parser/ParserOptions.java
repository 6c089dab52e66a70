package com.querylog.parser;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;

import com.querylog.filter.FilterConfig;
import com.querylog.parser.SqlMangler.MangleRule;
import com.querylog.parser.accumulator.ClusteringEngine;

/**
 * Run configuration of a {@link QueryLogProcessor}.
 */
public class ParserOptions {

    static final String THRESHOLD_KEY = "cluster.threshold";

    private static final Pattern BREAKOFF_FORMAT = Pattern.compile("^\\d{4}-\\d{1,2}-\\d{1,2}$");
    private static final DateTimeFormatter BREAKOFF_PARSER = DateTimeFormatter.ofPattern("uuuu-M-d")
            .withResolverStyle(ResolverStyle.LENIENT);

    private boolean verbose = false;
    private boolean coarse = false;
    private String breakoff = null;
    private double threshold = ClusteringEngine.DEFAULT_THRESHOLD;
    private int threads = 1;
    private FilterConfig filterConfig = new FilterConfig();
    private List<MangleRule> mangleRules = SqlMangler.defaultRules();

    /**
     * Applies a properties file: filter patterns, mangling rules and the
     * clustering threshold.
     */
    public void loadFromProperties(Properties props) {
        filterConfig.loadFromProperties(props);
        mangleRules = SqlMangler.rulesFromProperties(props);
        String thresholdValue = props.getProperty(THRESHOLD_KEY);
        if (thresholdValue != null && !thresholdValue.trim().isEmpty()) {
            try {
                setThreshold(Double.parseDouble(thresholdValue.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + THRESHOLD_KEY + ": " + thresholdValue, e);
            }
        }
    }

    /**
     * Validates a {@code YYYY-MM-DD} cutoff and returns it zero padded. One digit
     * months and days are accepted and impossible dates roll over, so 2017-02-29
     * becomes 2017-03-01.
     */
    public static String normalizeBreakoff(String value) {
        if (value == null || !BREAKOFF_FORMAT.matcher(value.trim()).matches()) {
            throw new IllegalArgumentException("The argument to breakoff should be a date formatted like YYYY-MM-DD");
        }
        try {
            return LocalDate.parse(value.trim(), BREAKOFF_PARSER).format(DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("The argument to breakoff is not a usable date: " + value, e);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public boolean isCoarse() {
        return coarse;
    }

    public void setCoarse(boolean coarse) {
        this.coarse = coarse;
    }

    /**
     * Cutoff date as {@code yyyy-MM-dd}, or null to read the whole log.
     */
    public String getBreakoff() {
        return breakoff;
    }

    public void setBreakoff(String breakoff) {
        this.breakoff = breakoff != null ? normalizeBreakoff(breakoff) : null;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Clustering threshold must be in (0, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Number of threads must be positive, got " + threads);
        }
        this.threads = threads;
    }

    public FilterConfig getFilterConfig() {
        return filterConfig;
    }

    public List<MangleRule> getMangleRules() {
        return mangleRules;
    }
}
