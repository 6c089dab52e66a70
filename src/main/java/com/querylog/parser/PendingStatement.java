package com.querylog.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single slot buffer for the statement currently being captured. A capture is
 * opened by a Query, Execute or Prepare header and closed by the next header.
 */
public class PendingStatement {

    private static final Logger logger = LoggerFactory.getLogger(PendingStatement.class);

    private StringBuilder sql;
    private String user;
    private boolean prepare;

    public void open(String initialText, String user, boolean prepare) {
        if (sql != null) {
            throw new ParserStateException("Statement capture opened while another capture for user "
                    + this.user + " is still open");
        }
        this.sql = new StringBuilder(initialText != null ? initialText : "");
        this.user = user;
        this.prepare = prepare;
    }

    /**
     * Appends a continuation line separated by a single space.
     *
     * @return false if no capture is open and the fragment was not taken
     */
    public boolean append(String fragment) {
        if (sql == null) {
            logger.debug("Fragment outside of a statement capture: '{}'", fragment);
            return false;
        }
        sql.append(' ').append(fragment);
        return true;
    }

    /**
     * Closes the capture and returns its contents, or null if nothing was open.
     */
    public CapturedStatement flush() {
        if (sql == null) {
            return null;
        }
        CapturedStatement captured = new CapturedStatement(sql.toString(), user, prepare);
        sql = null;
        user = null;
        prepare = false;
        return captured;
    }

    public boolean isOpen() {
        return sql != null;
    }

    public String getUser() {
        return user;
    }
}
