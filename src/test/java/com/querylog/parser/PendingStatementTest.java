package com.querylog.parser;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class PendingStatementTest {

    @Test
    public void testFragmentsAreJoinedWithASpace() {
        PendingStatement pending = new PendingStatement();
        pending.open("SELECT id", "app@host", false);
        assertTrue(pending.append("FROM t"));
        assertTrue(pending.append("WHERE id = 1"));

        CapturedStatement captured = pending.flush();
        assertEquals("SELECT id FROM t WHERE id = 1", captured.getSql());
        assertEquals("app@host", captured.getUser());
        assertFalse(captured.isPrepare());
        assertFalse(pending.isOpen());
    }

    @Test
    public void testFlushWithoutCaptureReturnsNull() {
        PendingStatement pending = new PendingStatement();
        assertNull(pending.flush());

        pending.open("SELECT 1", "app@host", true);
        assertTrue(pending.flush().isPrepare());
        assertNull(pending.flush());
    }

    @Test
    public void testAppendWithoutCaptureIsRejected() {
        PendingStatement pending = new PendingStatement();
        assertFalse(pending.append("stray text"));
        assertFalse(pending.isOpen());
    }

    @Test
    public void testOpeningTwiceFails() {
        PendingStatement pending = new PendingStatement();
        pending.open("SELECT 1", "app@host", false);

        assertThrows(ParserStateException.class, () -> pending.open("SELECT 2", "other@host", false));
        assertEquals("app@host", pending.getUser());
    }
}
