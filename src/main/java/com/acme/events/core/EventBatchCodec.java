package com.acme.events.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Encodes and decodes the {@code {"events":[...]}} wire format, validating every event.
 */
public final class EventBatchCodec {

    public static final int MAX_EVENT_TYPE_LENGTH = 100;

    private EventBatchCodec() {
    }

    public static List<Event> decode(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedMessageException("Empty message body");
        }
        EventBatch batch;
        try {
            batch = Jsons.read(body, EventBatch.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Undecodable event batch: " + e.getOriginalMessage(), e);
        }
        if (batch == null || batch.events() == null) {
            throw new MalformedMessageException("Missing 'events' array");
        }
        if (batch.events().isEmpty()) {
            throw new MalformedMessageException("Batch contains no events");
        }
        for (int i = 0; i < batch.events().size(); i++) {
            validate(i, batch.events().get(i));
        }
        return List.copyOf(batch.events());
    }

    public static String encode(List<Event> events) {
        return Jsons.toJson(new EventBatch(events));
    }

    public static int encodedSize(String body) {
        return body.getBytes(StandardCharsets.UTF_8).length;
    }

    static void validate(int index, Event e) {
        if (e == null) {
            throw new MalformedMessageException("events[" + index + "] is null");
        }
        if (e.eventId() == null) {
            throw new MalformedMessageException("events[" + index + "].event_id is required");
        }
        if (e.occurredAt() == null) {
            throw new MalformedMessageException("events[" + index + "].occurred_at is required");
        }
        if (e.userId() == null) {
            throw new MalformedMessageException("events[" + index + "].user_id is required");
        }
        if (e.eventType() == null || e.eventType().isBlank()) {
            throw new MalformedMessageException("events[" + index + "].event_type is required");
        }
        if (e.eventType().length() > MAX_EVENT_TYPE_LENGTH) {
            throw new MalformedMessageException(
                "events[" + index + "].event_type exceeds " + MAX_EVENT_TYPE_LENGTH + " characters");
        }
    }
}
