package com.acme.events.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionTest {

    @Test
    void testMalformedIsPermanent() {
        MalformedMessageException ex = new MalformedMessageException("bad");
        assertEquals("bad", ex.getMessage());
        assertTrue(ex instanceof PermanentException);
    }

    @Test
    void testTransientException() {
        var cause = new RuntimeException("io");
        TransientException ex = new TransientException("Transient error", cause);
        assertEquals("Transient error", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    void testInvalidBatchIsIllegalArgument() {
        assertTrue(new InvalidBatchException("too big") instanceof IllegalArgumentException);
    }
}
