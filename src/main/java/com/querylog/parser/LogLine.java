package com.querylog.parser;

import com.querylog.parser.SessionCommand.ParsedCommand;

/**
 * One classified line of the general query log.
 */
public final class LogLine {

    public enum Kind {
        HEADER, FRAGMENT, IGNORABLE
    }

    private static final LogLine IGNORABLE_LINE = new LogLine(Kind.IGNORABLE, null, -1, null, null, null);

    private final Kind kind;
    private final String timestamp;
    private final long connectionId;
    private final String remainder;
    private final ParsedCommand command;
    private final String text;

    private LogLine(Kind kind, String timestamp, long connectionId, String remainder, ParsedCommand command,
            String text) {
        this.kind = kind;
        this.timestamp = timestamp;
        this.connectionId = connectionId;
        this.remainder = remainder;
        this.command = command;
        this.text = text;
    }

    static LogLine header(String timestamp, long connectionId, String remainder) {
        return new LogLine(Kind.HEADER, timestamp, connectionId, remainder, SessionCommand.parse(remainder), null);
    }

    static LogLine fragment(String text) {
        return new LogLine(Kind.FRAGMENT, null, -1, null, null, text);
    }

    static LogLine ignorable() {
        return IGNORABLE_LINE;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Timestamp formatted as {@code yyyy-MM-dd HH:mm:ss}, or null for header lines
     * that only carry a connection id.
     */
    public String getTimestamp() {
        return timestamp;
    }

    public long getConnectionId() {
        return connectionId;
    }

    public SessionCommand getCommand() {
        return command != null ? command.getCommand() : null;
    }

    public String getArgument(int index) {
        return command != null ? command.getArgument(index) : null;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        switch (kind) {
        case HEADER:
            return "HEADER[" + (timestamp != null ? timestamp + " " : "") + connectionId + " " + remainder + "]";
        case FRAGMENT:
            return "FRAGMENT[" + text + "]";
        default:
            return "IGNORABLE";
        }
    }
}
