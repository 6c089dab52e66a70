package com.querylog.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces literal values in normalized SQL by {@code ~} so that statements that
 * only differ in their constants end up close in edit distance. This is
 * approximate and meant to be tuned per dataset.
 *
 * <p>Each rule is reapplied from the start of the statement until it no longer
 * matches, so a rule may also hit text produced by its own earlier replacement.
 */
public class SqlMangler {

    private static final Logger logger = LoggerFactory.getLogger(SqlMangler.class);

    static final String PREFIX = "mangle.rule.";
    static final String DEFAULTS_KEY = "mangle.defaults";

    private static final int MAX_REPLACEMENTS_PER_RULE = 10_000;

    public static final class MangleRule {
        private final String name;
        private final Pattern pattern;
        private final String replacement;

        public MangleRule(String name, String regex, String replacement) {
            this.name = name;
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
            checkReplacement();
        }

        /**
         * Rejects group references and escapes that {@link Matcher#appendReplacement}
         * would fail on, so a bad rule is reported when it is loaded.
         */
        private void checkReplacement() {
            int groupCount = pattern.matcher("").groupCount();
            int i = 0;
            while (i < replacement.length()) {
                char c = replacement.charAt(i++);
                if (c == '\\') {
                    if (i == replacement.length()) {
                        throw invalid("ends with an escape character");
                    }
                    i++;
                } else if (c == '$') {
                    if (i == replacement.length()) {
                        throw invalid("ends with a group reference character");
                    }
                    if (replacement.charAt(i) == '{') {
                        int end = replacement.indexOf('}', i);
                        if (end < 0) {
                            throw invalid("has an unterminated named group reference");
                        }
                        String group = replacement.substring(i + 1, end);
                        if (!pattern.pattern().contains("(?<" + group + ">")) {
                            throw invalid("refers to unknown group '" + group + "'");
                        }
                        i = end + 1;
                        continue;
                    }
                    int ref = Character.digit(replacement.charAt(i), 10);
                    if (ref < 0) {
                        throw invalid("has an illegal group reference");
                    }
                    if (ref > groupCount) {
                        throw invalid("refers to group " + ref + " but the pattern has " + groupCount);
                    }
                    i++;
                    // further digits belong to the reference while the group exists
                    while (i < replacement.length()) {
                        int next = Character.digit(replacement.charAt(i), 10);
                        if (next < 0 || ref * 10 + next > groupCount) {
                            break;
                        }
                        ref = ref * 10 + next;
                        i++;
                    }
                }
            }
        }

        private IllegalArgumentException invalid(String problem) {
            return new IllegalArgumentException("Mangling rule '" + name + "': replacement '" + replacement + "' "
                    + problem);
        }

        public String getName() {
            return name;
        }

        public Pattern getPattern() {
            return pattern;
        }

        public String getReplacement() {
            return replacement;
        }
    }

    private static final List<MangleRule> DEFAULT_RULES = List.of(
        new MangleRule("blob", "'[0-9A-F]{10,}'", "'~'"),
        new MangleRule("password", "'\\*[0-9A-F]+'", "'~'"),
        new MangleRule("date", "'\\d{4}-\\d{1,2}-\\d{1,2}'", "'~'"),
        new MangleRule("integer-string", "'\\d+'", "'~'"),
        new MangleRule("datetime", "'\\d\\d\\d\\d-\\d\\d-\\d\\d \\d\\d:\\d\\d:\\d\\d'", "'~'"),
        new MangleRule("month-year", "'\\d\\d/\\d\\d\\d\\d'", "'~'"),
        new MangleRule("id-column", "(ID(?:STAFF|CRM))\\s*=\\s*\\d+", "$1=~"),
        new MangleRule("amount-column", "(IREVENUE|IMTOW)\\s*=\\s*\\d+", "$1=~"),
        new MangleRule("id-list", "(ID(?:CRM|TRIP|MISSION))\\s+IN\\s+\\([\\d,]+\\)", "$1 IN (~)"),
        new MangleRule("ipv4", "'\\d+\\.\\d+\\.\\d+\\.\\d+'", "'~IPv4~'"),
        new MangleRule("id-string", "ID(MISSION|CRM)\\s*=\\s*'\\d+'", "ID$1='~'"),
        new MangleRule("date-column", "DATECRM\\s*(=|<|>|>=|<=|<>)\\s*'[^~]+?'", "DATECRM$1'~'")
    );

    private final List<MangleRule> rules;

    public SqlMangler() {
        this(DEFAULT_RULES);
    }

    public SqlMangler(List<MangleRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static List<MangleRule> defaultRules() {
        return DEFAULT_RULES;
    }

    /**
     * Builds the rule list from properties.
     * Supports:
     * - mangle.defaults: false drops the built-in rules
     * - mangle.rule.&lt;name&gt;.pattern / mangle.rule.&lt;name&gt;.replacement: an extra
     *   rule, applied after the built-ins in name order
     */
    public static List<MangleRule> rulesFromProperties(Properties props) {
        List<MangleRule> result = new ArrayList<>();
        String defaults = props.getProperty(DEFAULTS_KEY);
        if (defaults == null || Boolean.parseBoolean(defaults.trim())) {
            result.addAll(DEFAULT_RULES);
        }

        Set<String> names = new TreeSet<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(PREFIX) && key.endsWith(".pattern")) {
                names.add(key.substring(PREFIX.length(), key.length() - ".pattern".length()));
            }
        }
        for (String name : names) {
            String regex = props.getProperty(PREFIX + name + ".pattern");
            String replacement = props.getProperty(PREFIX + name + ".replacement", "~");
            result.add(new MangleRule(name, regex, replacement));
        }
        return result;
    }

    public String mangle(String normalizedSql) {
        String mangled = normalizedSql;
        for (MangleRule rule : rules) {
            mangled = applyRepeatedly(rule, mangled);
        }
        return mangled;
    }

    private String applyRepeatedly(MangleRule rule, String sql) {
        String current = sql;
        for (int i = 0; i < MAX_REPLACEMENTS_PER_RULE; i++) {
            Matcher m = rule.pattern.matcher(current);
            if (!m.find()) {
                return current;
            }
            StringBuilder sb = new StringBuilder(current.length());
            m.appendReplacement(sb, rule.replacement);
            m.appendTail(sb);
            String next = sb.toString();
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        logger.warn("Mangling rule '{}' still matches after {} replacements, giving up on: {}", rule.name,
                MAX_REPLACEMENTS_PER_RULE, current);
        return current;
    }

    public List<MangleRule> getRules() {
        return rules;
    }
}
