package com.acme.events.core;

/**
 * Publishing to the dead-letter subject failed. Never retried by the application.
 */
public class DeadLetterPublishException extends RuntimeException {
    public DeadLetterPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
