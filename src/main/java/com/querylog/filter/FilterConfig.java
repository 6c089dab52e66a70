package com.querylog.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides which normalized statements are session noise and must not be counted.
 * Patterns are anchored at the start of the statement.
 */
public class FilterConfig {

    static final String PREFIX = "filter.ignore.";
    static final String DEFAULTS_KEY = PREFIX + "defaults";
    static final String REMOVE_KEY = PREFIX + "remove";

    private final Map<String, Pattern> ignorePatterns = new LinkedHashMap<>();
    private final List<Predicate<String>> exclusions = new ArrayList<>();

    public FilterConfig() {
        initializeDefaults();
    }

    private void initializeDefaults() {
        // Session setup issued by drivers and connectors
        addPattern("set-session", "SET (NAMES|AUTOCOMMIT|CHARACTER|SESSION|OPTIMIZER|CHARACTER_SET_RESULTS|SQL_"
                + "|@@TX_ISOLATION|@@SQL_SELECT_LIMIT)");
        addPattern("select-session", "SELECT (DATABASE|@@TX_ISOLATION|CURRENT_USER)");

        // Administrative statements
        addPattern("show", "SHOW ");
        addPattern("commit", "COMMIT");
        addPattern("use", "USE ");
        addPattern("explain", "EXPLAIN ");
        addPattern("describe", "DESCRIBE ");
        addPattern("lock-tables", "(UN)?LOCK TABLES");
    }

    /**
     * Load patterns from properties.
     * Supports:
     * - filter.ignore.defaults: false drops the built-in patterns
     * - filter.ignore.remove: comma-separated names of patterns to drop
     * - filter.ignore.&lt;name&gt;: an additional pattern under that name
     */
    public void loadFromProperties(Properties props) {
        String defaults = props.getProperty(DEFAULTS_KEY);
        if (defaults != null && !Boolean.parseBoolean(defaults.trim())) {
            ignorePatterns.clear();
        }

        Set<String> keys = new TreeSet<>(props.stringPropertyNames());
        for (String key : keys) {
            if (!key.startsWith(PREFIX) || key.equals(DEFAULTS_KEY) || key.equals(REMOVE_KEY)) {
                continue;
            }
            String regex = props.getProperty(key).trim();
            if (!regex.isEmpty()) {
                addPattern(key.substring(PREFIX.length()), regex);
            }
        }

        String removeList = props.getProperty(REMOVE_KEY);
        if (removeList != null && !removeList.trim().isEmpty()) {
            for (String name : removeList.split(",")) {
                removePattern(name.trim());
            }
        }
    }

    public void addPattern(String name, String regex) {
        ignorePatterns.put(name, Pattern.compile(regex));
    }

    public void removePattern(String name) {
        ignorePatterns.remove(name);
    }

    /**
     * Adds a domain specific predicate; a statement for which it returns true is ignored.
     */
    public void addExclusion(Predicate<String> exclusion) {
        exclusions.add(exclusion);
    }

    public Set<String> getPatternNames() {
        return new TreeSet<>(ignorePatterns.keySet());
    }

    public boolean shouldIgnore(String normalizedSql) {
        for (Pattern p : ignorePatterns.values()) {
            if (p.matcher(normalizedSql).lookingAt()) {
                return true;
            }
        }
        return exclusions.stream().anyMatch(e -> e.test(normalizedSql));
    }
}
