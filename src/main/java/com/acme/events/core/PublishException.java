package com.acme.events.core;

/**
 * The broker refused or failed to accept a message.
 */
public class PublishException extends RuntimeException {
    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
