package com.querylog.parser;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw general query log lines into headers, SQL fragments and boilerplate.
 *
 * <p>The log is column oriented rather than delimited. A header either starts with
 * a timestamp followed by the connection id:
 *
 * <pre>
 * 171215  4:17:03 124090 Query    SELECT ...
 * </pre>
 *
 * or with whitespace (two tabs) followed by the connection id and an action keyword:
 *
 * <pre>
 *                 123753 Query    SELECT ...
 * </pre>
 *
 * Everything else is a fragment of a multi-line statement. A fragment such as
 * {@code "   5 Quit"} is indistinguishable from a header and is classified as one.
 */
public class LogLineClassifier {

    static final String TAB_EXPANSION = "        ";

    private static final List<Pattern> BOILERPLATE = List.of(
        Pattern.compile("^\\S*mysqld(\\.exe)?, Version:"),
        Pattern.compile("^Tcp port: \\d+\\s+Unix socket:"),
        Pattern.compile("^Time\\s+Id\\s+Command\\s+Argument")
    );

    private static final Pattern TIMESTAMPED_HEADER = Pattern.compile(
        "^(\\d\\d)(\\d\\d)(\\d\\d)\\s+(\\d{1,2}):(\\d{1,2}):(\\d{1,2})\\s+(\\d{1,18})\\s+(.*)$");

    private static final Pattern COLUMN_HEADER = Pattern.compile(
        "^\\s+(\\d{1,18})\\s+((?:Query|Quit|Connect|Init|Refresh|Prepare|Execute|Close stmt).*?)\\s*$");

    public LogLine classify(String rawLine) {
        for (Pattern p : BOILERPLATE) {
            if (p.matcher(rawLine).lookingAt()) {
                return LogLine.ignorable();
            }
        }

        String line = rawLine.replace("\t", TAB_EXPANSION);
        if (line.isBlank()) {
            return LogLine.ignorable();
        }

        Matcher m = TIMESTAMPED_HEADER.matcher(line);
        if (m.matches()) {
            String timestamp = String.format("%04d-%02d-%02d %02d:%02d:%02d",
                2000 + Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)),
                Integer.parseInt(m.group(5)),
                Integer.parseInt(m.group(6)));
            return LogLine.header(timestamp, Long.parseLong(m.group(7)), m.group(8));
        }

        m = COLUMN_HEADER.matcher(line);
        if (m.matches()) {
            return LogLine.header(null, Long.parseLong(m.group(1)), m.group(2));
        }

        return LogLine.fragment(line);
    }
}
