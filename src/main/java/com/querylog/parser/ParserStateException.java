package com.querylog.parser;

/**
 * Internal consistency failure of the parser. Signals a parser bug rather than
 * bad input, so processing stops and no report is produced.
 */
public class ParserStateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long lineNumber;
    private final String line;

    public ParserStateException(String message) {
        super(message);
        this.lineNumber = -1;
        this.line = null;
    }

    public ParserStateException(String message, long lineNumber, String line, Throwable cause) {
        super(message + " (line " + lineNumber + ": '" + line + "')", cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    public boolean hasLocation() {
        return line != null;
    }
}
