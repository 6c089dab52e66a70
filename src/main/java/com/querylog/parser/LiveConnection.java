package com.querylog.parser;

/**
 * A connection that is open at the current position of the log.
 */
public class LiveConnection {

    private final long connectionId;
    private final String user;
    private final String connectedAt;
    private String database;

    public LiveConnection(long connectionId, String user, String database, String connectedAt) {
        this.connectionId = connectionId;
        this.user = user;
        this.database = database;
        this.connectedAt = connectedAt;
    }

    public long getConnectionId() {
        return connectionId;
    }

    public String getUser() {
        return user;
    }

    public String getConnectedAt() {
        return connectedAt;
    }

    /**
     * Database named at connect time or by the latest Init DB, may be null.
     */
    public String getDatabase() {
        return database;
    }

    void setDatabase(String database) {
        this.database = database;
    }

    @Override
    public String toString() {
        return "conn" + connectionId + " " + user + (database != null ? " on " + database : "") + " since "
                + connectedAt;
    }
}
