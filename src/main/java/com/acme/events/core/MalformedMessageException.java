package com.acme.events.core;

/**
 * The message body or its retry headers cannot be decoded. Goes straight to the dead-letter subject.
 */
public class MalformedMessageException extends PermanentException {
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
