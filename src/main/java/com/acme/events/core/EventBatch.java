package com.acme.events.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire format shared by the HTTP body and the broker message body.
 */
public record EventBatch(@JsonProperty("events") List<Event> events) {}
