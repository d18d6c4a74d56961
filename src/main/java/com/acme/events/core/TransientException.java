package com.acme.events.core;

/**
 * A failure that may succeed on a later attempt, e.g. storage unavailable or a timeout.
 */
public class TransientException extends RuntimeException {
    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
