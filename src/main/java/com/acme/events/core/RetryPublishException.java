package com.acme.events.core;

public class RetryPublishException extends RuntimeException {
    public RetryPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
