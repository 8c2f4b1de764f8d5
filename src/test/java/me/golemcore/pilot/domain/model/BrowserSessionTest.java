package me.golemcore.pilot.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrowserSessionTest {

    private static final Instant STARTED = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldComputeExpiryFromStartAndTimeout() {
        BrowserSession session = BrowserSession.builder().startedAt(STARTED).timeoutMinutes(30).build();

        assertEquals(Instant.parse("2026-03-01T10:30:00Z"), session.getExpiresAt());
        assertFalse(session.isExpiredAt(Instant.parse("2026-03-01T10:29:59Z")));
        assertTrue(session.isExpiredAt(Instant.parse("2026-03-01T10:30:00Z")));
    }

    @Test
    void shouldNeverExpireBeforeStart() {
        BrowserSession session = BrowserSession.builder().timeoutMinutes(30).build();

        assertNull(session.getExpiresAt());
        assertFalse(session.isExpiredAt(Instant.MAX));
    }

    @Test
    void shouldTreatFinalStatusAsCompleted() {
        BrowserSession session = BrowserSession.builder().status(BrowserSessionStatus.FAILED).build();

        assertTrue(session.isCompleted());
        assertFalse(session.isOccupied());
    }
}
