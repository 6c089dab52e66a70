package com.querylog.parser;

import java.util.Locale;
import java.util.regex.Pattern;

import com.querylog.filter.FilterConfig;

/**
 * Normalizes captured SQL and decides whether it is counted.
 */
public class StatementClassifier {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public enum Outcome {
        EMPTY, UNINTERESTING, PREPARE, COUNTED
    }

    public static final class Result {
        private final Outcome outcome;
        private final String normalized;
        private final Verb verb;

        Result(Outcome outcome, String normalized, Verb verb) {
            this.outcome = outcome;
            this.normalized = normalized;
            this.verb = verb;
        }

        public Outcome getOutcome() {
            return outcome;
        }

        public String getNormalized() {
            return normalized;
        }

        /**
         * Verb of a counted statement, null for any other outcome.
         */
        public Verb getVerb() {
            return verb;
        }
    }

    private final FilterConfig filterConfig;

    public StatementClassifier(FilterConfig filterConfig) {
        this.filterConfig = filterConfig;
    }

    public static String normalize(String sql) {
        return WHITESPACE.matcher(sql.toUpperCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    public Result classify(String sql, boolean prepare) {
        String normalized = normalize(sql);
        if (normalized.isEmpty()) {
            return new Result(Outcome.EMPTY, normalized, null);
        }
        if (filterConfig.shouldIgnore(normalized)) {
            return new Result(Outcome.UNINTERESTING, normalized, null);
        }
        // the matching Execute carries the statement that gets counted
        if (prepare) {
            return new Result(Outcome.PREPARE, normalized, null);
        }
        return new Result(Outcome.COUNTED, normalized, Verb.classify(normalized));
    }
}
