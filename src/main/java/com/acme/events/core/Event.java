package com.acme.events.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A single user event. The event id is the idempotency key.
 */
public record Event(
    @JsonProperty("event_id") UUID eventId,
    @JsonProperty("occurred_at") @JsonDeserialize(using = OccurredAtDeserializer.class) OffsetDateTime occurredAt,
    @JsonProperty("user_id") Long userId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("properties") Map<String, Object> properties
) {
    public Event {
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
