package com.acme.events.core;

/**
 * Rejected at the ingestion boundary; reported to the caller as 400.
 */
public class InvalidBatchException extends IllegalArgumentException {
    public InvalidBatchException(String message) {
        super(message);
    }

    public InvalidBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
