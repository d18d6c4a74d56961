package com.acme.events.core;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * A message parked on the dead-letter subject: the original body untouched plus the retry
 * envelope and the reason it was parked.
 */
public record DeadLetterRecord(
    String payload,
    RetryEnvelope retry,
    Reason reason,
    Instant deadLetteredAt,
    String deadLetteredBy
) {
    public static final String REASON = "dead_letter_reason";
    public static final String DEAD_LETTERED_AT = "dead_lettered_at";
    public static final String DEAD_LETTERED_BY = "dead_lettered_by";

    public enum Reason {
        MALFORMED,
        RETRIES_EXHAUSTED
    }

    public DeadLetterRecord {
        if (retry == null || reason == null || deadLetteredAt == null) {
            throw new IllegalArgumentException("retry, reason and deadLetteredAt are required");
        }
        payload = payload == null ? "" : payload;
    }

    public Map<String,String> toHeaders() {
        var headers = retry.toHeaders();
        headers.put(REASON, reason.name());
        headers.put(DEAD_LETTERED_AT, deadLetteredAt.toString());
        if (deadLetteredBy != null) {
            headers.put(DEAD_LETTERED_BY, deadLetteredBy);
        }
        return headers;
    }

    /**
     * Rebuilds a record from a message read off the dead-letter subject.
     *
     * @throws IllegalArgumentException if the headers are not those of a dead-letter record
     */
    public static DeadLetterRecord fromMessage(String body, Map<String,String> headers) {
        String subject = headers.get(RetryEnvelope.ORIGINAL_SUBJECT);
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Missing " + RetryEnvelope.ORIGINAL_SUBJECT + " header");
        }
        String reason = headers.get(REASON);
        if (reason == null) {
            throw new IllegalArgumentException("Missing " + REASON + " header");
        }
        Instant at;
        try {
            at = Instant.parse(headers.getOrDefault(DEAD_LETTERED_AT, ""));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Bad " + DEAD_LETTERED_AT + " header", e);
        }
        return new DeadLetterRecord(
            body,
            RetryEnvelope.bestEffort(headers, subject),
            Reason.valueOf(reason),
            at,
            headers.get(DEAD_LETTERED_BY));
    }

    /**
     * The message an operator would publish to reprocess this record: same body, back on the
     * original subject, with a fresh retry budget.
     */
    public Replay toReplay() {
        var fresh = retry.resetForReplay();
        return new Replay(fresh.originalSubject(), payload, fresh.toHeaders());
    }

    public record Replay(String subject, String payload, Map<String,String> headers) {
        public Replay {
            headers = Map.copyOf(headers);
        }
    }
}
