package com.acme.events.core;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Accepts ISO-8601 timestamps with or without an offset.
 *
 * <pre>
 * "2025-10-20T12:00:00+02:00" -> 2025-10-20T12:00+02:00
 * "2025-10-20T12:00:00Z"      -> 2025-10-20T12:00Z
 * "2025-10-20T12:00:00"       -> 2025-10-20T12:00Z (no offset means UTC)
 * </pre>
 */
public final class OccurredAtDeserializer extends JsonDeserializer<OffsetDateTime> {

    @Override
    public OffsetDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw InvalidFormatException.from(p, "occurred_at must be an ISO-8601 string", node.toString(), OffsetDateTime.class);
        }
        String raw = node.asText().trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(raw, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt;
            }
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw InvalidFormatException.from(p, "occurred_at is not an ISO-8601 date-time", raw, OffsetDateTime.class);
        }
    }
}
