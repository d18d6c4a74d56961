package com.acme.events.pg;

import com.acme.events.core.Event;
import com.acme.events.core.Jsons;
import com.acme.events.core.TransientException;
import com.acme.events.spi.EventStore;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Singleton
public class PgEventStore implements EventStore {
    static final String INSERT =
        "insert into event(event_id, occurred_at, event_date, user_id, event_type, properties) " +
        "values (?,?,?,?,?,?) on conflict do nothing";

    private final TransactionOperations<Connection> tx;

    public PgEventStore(TransactionOperations<Connection> tx) {
        this.tx = tx;
    }

    @Override
    public Set<UUID> insertIfAbsent(List<Event> events) {
        if (events.isEmpty()) {
            return Set.of();
        }
        try {
            return tx.executeWrite(status -> {
                var applied = new LinkedHashSet<UUID>();
                try (var ps = status.getConnection().prepareStatement(INSERT)) {
                    for (var e : events) {
                        ps.setObject(1, e.eventId());
                        ps.setObject(2, e.occurredAt());
                        ps.setObject(3, e.occurredAt().atZoneSameInstant(ZoneOffset.UTC).toLocalDate());
                        ps.setLong(4, e.userId());
                        ps.setString(5, e.eventType());
                        ps.setString(6, Jsons.toJson(e.properties()));
                        // one row per execute: the update count tells us whether this id was new
                        if (ps.executeUpdate() == 1) {
                            applied.add(e.eventId());
                        }
                    }
                } catch (SQLException ex) {
                    throw new TransientException("Failed to insert events: " + ex.getMessage(), ex);
                }
                return applied;
            });
        } catch (TransientException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientException("Event store unavailable: " + e.getMessage(), e);
        }
    }
}
