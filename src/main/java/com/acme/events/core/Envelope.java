package com.acme.events.core;

import java.util.Map;

/**
 * A broker message as seen by the consumer: the body is kept verbatim so it can be republished
 * or dead-lettered unchanged.
 */
public record Envelope(
    String messageId,
    String subject,
    Map<String,String> headers,
    String payload
) {
    public Envelope {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
