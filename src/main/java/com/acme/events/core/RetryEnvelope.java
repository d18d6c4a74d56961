package com.acme.events.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Retry state carried in message headers. There is no other retry store: whatever is not in
 * these headers is forgotten between deliveries.
 */
public record RetryEnvelope(int attemptCount, String originalSubject, String lastError) {

    public static final String ATTEMPT_COUNT = "attempt_count";
    public static final String ORIGINAL_SUBJECT = "original_subject";
    public static final String LAST_ERROR = "last_error";

    static final int MAX_ERROR_LENGTH = 1000;

    public RetryEnvelope {
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be >= 0");
        }
        if (originalSubject == null || originalSubject.isBlank()) {
            throw new IllegalArgumentException("originalSubject is required");
        }
        lastError = truncate(lastError);
    }

    public static RetryEnvelope initial(String subject) {
        return new RetryEnvelope(0, subject, null);
    }

    /**
     * Reads the envelope from message headers. A missing attempt count means a first delivery;
     * a present but unreadable one makes the message malformed.
     */
    public static RetryEnvelope fromHeaders(Map<String, String> headers, String fallbackSubject) {
        String subject = headers.getOrDefault(ORIGINAL_SUBJECT, fallbackSubject);
        if (subject == null || subject.isBlank()) {
            subject = fallbackSubject;
        }
        return new RetryEnvelope(parseAttempt(headers.get(ATTEMPT_COUNT)), subject, headers.get(LAST_ERROR));
    }

    /**
     * Like {@link #fromHeaders} but never fails; used when the message is already known to be malformed.
     */
    public static RetryEnvelope bestEffort(Map<String, String> headers, String fallbackSubject) {
        try {
            return fromHeaders(headers, fallbackSubject);
        } catch (MalformedMessageException e) {
            String subject = headers.getOrDefault(ORIGINAL_SUBJECT, fallbackSubject);
            return new RetryEnvelope(0, subject == null || subject.isBlank() ? fallbackSubject : subject,
                headers.get(LAST_ERROR));
        }
    }

    /**
     * Returns this envelope bound to {@code subject}. Retries only ever go back to the working
     * subject, whatever the incoming header claims.
     */
    public RetryEnvelope pinnedTo(String subject) {
        return subject.equals(originalSubject) ? this : new RetryEnvelope(attemptCount, subject, lastError);
    }

    public RetryEnvelope nextAttempt(String error) {
        return new RetryEnvelope(Math.addExact(attemptCount, 1), originalSubject, error);
    }

    public RetryEnvelope withError(String error) {
        return new RetryEnvelope(attemptCount, originalSubject, error);
    }

    public RetryEnvelope resetForReplay() {
        return new RetryEnvelope(0, originalSubject, null);
    }

    public boolean exhausted(int budget) {
        return attemptCount >= budget;
    }

    public Map<String, String> toHeaders() {
        var headers = new HashMap<String, String>();
        headers.put(ATTEMPT_COUNT, Integer.toString(attemptCount));
        headers.put(ORIGINAL_SUBJECT, originalSubject);
        if (lastError != null) {
            headers.put(LAST_ERROR, lastError);
        }
        return headers;
    }

    private static int parseAttempt(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 0) {
                throw new MalformedMessageException("Negative " + ATTEMPT_COUNT + " header: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("Unreadable " + ATTEMPT_COUNT + " header: " + raw, e);
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
