package com.querylog.parser;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live connections keyed by connection id. Ids restart at 1 when the server
 * restarts, so a Connect on an id that is still live replaces the old session.
 */
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    public static final long BOOTSTRAP_CONNECTION_ID = 1;
    public static final String BOOTSTRAP_USER = "root";
    public static final String EPOCH_TIMESTAMP = "1970-01-01 00:00:00";

    private final Map<Long, LiveConnection> liveConnections = new HashMap<>();

    public ConnectionRegistry() {
        // the first connection never shows up as a Connect line
        liveConnections.put(BOOTSTRAP_CONNECTION_ID,
                new LiveConnection(BOOTSTRAP_CONNECTION_ID, BOOTSTRAP_USER, null, EPOCH_TIMESTAMP));
    }

    /**
     * Registers a new session.
     *
     * @return the session that was live under the same id and got replaced, or null
     */
    public LiveConnection connect(long connectionId, String user, String database, String timestamp) {
        LiveConnection stale = liveConnections.remove(connectionId);
        if (stale != null) {
            logger.info("Connection {} forcefully removed from live connections at {} (server restart?), was {}",
                    connectionId, timestamp, stale);
        }
        LiveConnection conn = new LiveConnection(connectionId, user, database, timestamp);
        liveConnections.put(connectionId, conn);
        if (logger.isDebugEnabled()) {
            logger.debug("New connection by user '{}' at {} with connid {}{}", user, timestamp, connectionId,
                    database != null ? " on database '" + database + "'" : "");
        }
        return stale;
    }

    public LiveConnection lookup(long connectionId) {
        return liveConnections.get(connectionId);
    }

    public boolean disconnect(long connectionId) {
        LiveConnection removed = liveConnections.remove(connectionId);
        if (removed == null) {
            logger.warn("Connection {} disconnected but it is not in the live connections map", connectionId);
            return false;
        }
        logger.debug("Connection {} removed from live connections", connectionId);
        return true;
    }

    public boolean setDatabase(long connectionId, String database) {
        LiveConnection conn = liveConnections.get(connectionId);
        if (conn == null) {
            logger.warn("Connection {} switched to database {} but it is not in the live connections map",
                    connectionId, database);
            return false;
        }
        conn.setDatabase(database);
        logger.debug("Connection {} connects to database {}", connectionId, database);
        return true;
    }

    public boolean contains(long connectionId) {
        return liveConnections.containsKey(connectionId);
    }

    public int size() {
        return liveConnections.size();
    }
}
