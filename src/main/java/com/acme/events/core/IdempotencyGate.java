package com.acme.events.core;

import com.acme.events.spi.EventStore;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Lets each event id through at most once. The store's primary key is the only witness, so two
 * workers racing on the same id cannot both apply it.
 */
@Singleton
public class IdempotencyGate {
    private final EventStore store;

    public IdempotencyGate(EventStore store) {
        this.store = store;
    }

    public GateResult apply(List<Event> events) {
        var unique = new LinkedHashMap<UUID, Event>();
        for (var e : events) {
            unique.putIfAbsent(e.eventId(), e);
        }
        Set<UUID> applied = store.insertIfAbsent(new ArrayList<>(unique.values()));
        var duplicates = new LinkedHashSet<UUID>();
        for (var id : unique.keySet()) {
            if (!applied.contains(id)) {
                duplicates.add(id);
            }
        }
        return new GateResult(applied, duplicates);
    }

    public record GateResult(Set<UUID> applied, Set<UUID> duplicates) {
        public GateResult {
            applied = Set.copyOf(applied);
            duplicates = Set.copyOf(duplicates);
        }

        public boolean allDuplicates() {
            return applied.isEmpty();
        }
    }
}
