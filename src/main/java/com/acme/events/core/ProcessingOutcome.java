package com.acme.events.core;

public enum ProcessingOutcome {
    /** At least one event of the batch was written. */
    PERSISTED,
    /** Every event was already witnessed; nothing written. */
    DUPLICATE,
    /** Persistence failed; republished to the working subject with a delivery delay. */
    RETRY_SCHEDULED,
    /** Malformed input or retry budget exhausted. */
    DEAD_LETTERED
}
