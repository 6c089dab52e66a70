package com.querylog.parser;

/**
 * A completed statement handed over by {@link PendingStatement#flush()}.
 */
public final class CapturedStatement {

    private final String sql;
    private final String user;
    private final boolean prepare;

    CapturedStatement(String sql, String user, boolean prepare) {
        this.sql = sql;
        this.user = user;
        this.prepare = prepare;
    }

    public String getSql() {
        return sql;
    }

    public String getUser() {
        return user;
    }

    public boolean isPrepare() {
        return prepare;
    }
}
