package com.acme.events.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetryEnvelopeTest {

    @Test
    void testMissingAttemptCountMeansFirstDelivery() {
        var env = RetryEnvelope.fromHeaders(Map.of(), "events.ingest");

        assertEquals(0, env.attemptCount());
        assertEquals("events.ingest", env.originalSubject());
        assertNull(env.lastError());
    }

    @Test
    void testReadsHeaders() {
        var env = RetryEnvelope.fromHeaders(Map.of(
            "attempt_count", "3",
            "original_subject", "events.custom",
            "last_error", "boom"), "events.ingest");

        assertEquals(3, env.attemptCount());
        assertEquals("events.custom", env.originalSubject());
        assertEquals("boom", env.lastError());
    }

    @Test
    void testUnparsableAttemptCountIsMalformed() {
        assertThrows(MalformedMessageException.class,
            () -> RetryEnvelope.fromHeaders(Map.of("attempt_count", "three"), "events.ingest"));
        assertThrows(MalformedMessageException.class,
            () -> RetryEnvelope.fromHeaders(Map.of("attempt_count", "-1"), "events.ingest"));
    }

    @Test
    void testBestEffortNeverFails() {
        var env = RetryEnvelope.bestEffort(Map.of("attempt_count", "x", "last_error", "old"), "events.ingest");

        assertEquals(0, env.attemptCount());
        assertEquals("old", env.lastError());
    }

    @Test
    void testNextAttemptKeepsSubjectAndOverwritesError() {
        var env = new RetryEnvelope(2, "events.ingest", "first");
        var next = env.nextAttempt("second");

        assertEquals(3, next.attemptCount());
        assertEquals("events.ingest", next.originalSubject());
        assertEquals("second", next.lastError());
        assertEquals(2, env.attemptCount());
    }

    @Test
    void testLastErrorIsTruncated() {
        var env = RetryEnvelope.initial("events.ingest").nextAttempt("x".repeat(5000));
        assertEquals(RetryEnvelope.MAX_ERROR_LENGTH, env.lastError().length());
    }

    @Test
    void testExhausted() {
        assertFalse(new RetryEnvelope(4, "events.ingest", null).exhausted(5));
        assertTrue(new RetryEnvelope(5, "events.ingest", null).exhausted(5));
        assertTrue(new RetryEnvelope(0, "events.ingest", null).exhausted(0));
    }

    @Test
    void testToHeaders() {
        var headers = new RetryEnvelope(1, "events.ingest", "boom").toHeaders();

        assertEquals("1", headers.get("attempt_count"));
        assertEquals("events.ingest", headers.get("original_subject"));
        assertEquals("boom", headers.get("last_error"));
        assertFalse(RetryEnvelope.initial("events.ingest").toHeaders().containsKey("last_error"));
    }

    @Test
    void testResetForReplay() {
        var reset = new RetryEnvelope(5, "events.ingest", "boom").resetForReplay();

        assertEquals(0, reset.attemptCount());
        assertEquals("events.ingest", reset.originalSubject());
        assertNull(reset.lastError());
    }

    @Test
    void testPinnedToKeepsCountAndError() {
        var env = new RetryEnvelope(3, "events.dlq", "boom");

        var pinned = env.pinnedTo("events.ingest");

        assertEquals(3, pinned.attemptCount());
        assertEquals("events.ingest", pinned.originalSubject());
        assertEquals("boom", pinned.lastError());
        assertSame(pinned, pinned.pinnedTo("events.ingest"));
    }
}
