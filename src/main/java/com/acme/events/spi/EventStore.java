package com.acme.events.spi;

import com.acme.events.core.Event;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public interface EventStore {
    /**
     * Inserts every event that is not already stored, all in one transaction.
     *
     * @return ids of the events actually written by this call
     */
    Set<UUID> insertIfAbsent(List<Event> events);
}
