package com.querylog.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Session commands found after the connection id of a header line. Constants are
 * tried in declaration order, so CONNECT must stay ahead of ACCESS_DENIED.
 */
public enum SessionCommand {
    CONNECT("^\\s*Connect\\s+(\\S+)\\s*on\\s*(\\S*)\\s*$"),
    ACCESS_DENIED("^\\s*Connect\\s+Access denied for user (\\S+)\\s.*$"),
    QUIT("^\\s*Quit\\s*$"),
    INIT_DB("^\\s*Init DB\\s+(\\S*)\\s*$"),
    REFRESH("^\\s*Refresh\\s*$"),
    CLOSE_STMT("^\\s*Close stmt\\s*$"),
    QUERY("^\\s*Query\\s+(.*)$"),
    EXECUTE("^\\s*Execute\\s+(.*)$"),
    PREPARE("^\\s*Prepare\\s+(.*)$"),
    UNKNOWN(null);

    private final Pattern pattern;

    SessionCommand(String regex) {
        this.pattern = regex != null ? Pattern.compile(regex) : null;
    }

    /**
     * True for commands whose argument is the (possibly multi-line) SQL text.
     */
    public boolean opensCapture() {
        return this == QUERY || this == EXECUTE || this == PREPARE;
    }

    /**
     * True for commands that are handled before the connection id is looked up.
     */
    public boolean isConnectAttempt() {
        return this == CONNECT || this == ACCESS_DENIED;
    }

    /**
     * Finds the first command matching the remainder of a header line and returns
     * it together with its captured arguments.
     */
    public static ParsedCommand parse(String remainder) {
        for (SessionCommand command : values()) {
            if (command.pattern == null) {
                continue;
            }
            Matcher m = command.pattern.matcher(remainder);
            if (m.matches()) {
                String[] arguments = new String[m.groupCount()];
                for (int i = 0; i < arguments.length; i++) {
                    arguments[i] = m.group(i + 1);
                }
                return new ParsedCommand(command, arguments);
            }
        }
        return new ParsedCommand(UNKNOWN, new String[0]);
    }

    public static final class ParsedCommand {
        private final SessionCommand command;
        private final String[] arguments;

        ParsedCommand(SessionCommand command, String[] arguments) {
            this.command = command;
            this.arguments = arguments;
        }

        public SessionCommand getCommand() {
            return command;
        }

        public String getArgument(int index) {
            return index < arguments.length ? arguments[index] : null;
        }
    }
}
