package com.acme.events.test;

import com.acme.events.core.Event;
import com.acme.events.core.EventBatchCodec;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class TestEvents {

    private TestEvents() {
    }

    public static Event event(long userId, String type) {
        return event(UUID.randomUUID(), userId, type, OffsetDateTime.of(2025, 10, 20, 12, 0, 0, 0, ZoneOffset.UTC));
    }

    public static Event event(UUID id, long userId, String type, OffsetDateTime at) {
        return new Event(id, at, userId, type, Map.of("source", "test"));
    }

    public static String batch(Event... events) {
        return EventBatchCodec.encode(List.of(events));
    }
}
