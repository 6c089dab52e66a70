package com.querylog.parser;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class ConnectionRegistryTest {

    @Test
    public void testBootstrapConnectionIsLive() {
        ConnectionRegistry registry = new ConnectionRegistry();

        LiveConnection root = registry.lookup(ConnectionRegistry.BOOTSTRAP_CONNECTION_ID);
        assertNotNull(root);
        assertEquals("root", root.getUser());
        assertEquals(ConnectionRegistry.EPOCH_TIMESTAMP, root.getConnectedAt());
        assertEquals(1, registry.size());
    }

    @Test
    public void testConnectAndDisconnect() {
        ConnectionRegistry registry = new ConnectionRegistry();
        assertNull(registry.connect(5, "app@host", "shop", "2017-12-15 10:00:00"));

        LiveConnection conn = registry.lookup(5);
        assertEquals("app@host", conn.getUser());
        assertEquals("shop", conn.getDatabase());

        assertTrue(registry.disconnect(5));
        assertFalse(registry.contains(5));
        assertFalse(registry.disconnect(5));
    }

    @Test
    public void testReusedIdReplacesStaleConnection() {
        ConnectionRegistry registry = new ConnectionRegistry();
        registry.connect(5, "userA@host", null, "2017-12-15 10:00:00");

        LiveConnection stale = registry.connect(5, "userB@host", null, "2017-12-15 11:00:00");

        assertEquals("userA@host", stale.getUser());
        assertEquals("userB@host", registry.lookup(5).getUser());
        assertEquals(2, registry.size());
    }

    @Test
    public void testSetDatabase() {
        ConnectionRegistry registry = new ConnectionRegistry();
        registry.connect(6, "report@localhost", "shop", "2017-12-15 10:00:00");

        assertTrue(registry.setDatabase(6, "archive"));
        assertEquals("archive", registry.lookup(6).getDatabase());
        assertFalse(registry.setDatabase(7, "archive"));
        assertNull(registry.lookup(7));
    }
}
