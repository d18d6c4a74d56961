package com.acme.events.pg;

import com.acme.events.core.TransientException;
import com.acme.events.spi.AnalyticsQueries;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Singleton
public class PgAnalyticsQueries implements AnalyticsQueries {
    private static final String DAU =
        "select event_date, count(distinct user_id) from event " +
        "where event_date >= ? and event_date <= ? group by event_date order by event_date";
    private static final String TOP_EVENTS =
        "select event_type, count(*) as cnt from event " +
        "where event_date >= ? and event_date <= ? group by event_type order by cnt desc, event_type limit ?";
    private static final String ACTIVE_USERS =
        "select count(distinct user_id) from event where event_date >= ? and event_date < ?";
    private static final String RETAINED_USERS =
        "select count(distinct user_id) from event where event_date >= ? and event_date < ? " +
        "and user_id in (select user_id from event where event_date >= ? and event_date < ?)";

    private final ConnectionOperations<Connection> connectionOps;

    public PgAnalyticsQueries(ConnectionOperations<Connection> connectionOps) {
        this.connectionOps = connectionOps;
    }

    @Override
    public List<DailyActiveUsers> dailyActiveUsers(LocalDate from, LocalDate to) {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement(DAU)) {
                ps.setObject(1, from);
                ps.setObject(2, to);
                var out = new ArrayList<DailyActiveUsers>();
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new DailyActiveUsers(rs.getObject(1, LocalDate.class), rs.getLong(2)));
                    }
                }
                return out;
            } catch (SQLException e) {
                throw new TransientException("DAU query failed", e);
            }
        });
    }

    @Override
    public List<EventTypeCount> topEvents(LocalDate from, LocalDate to, int limit) {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement(TOP_EVENTS)) {
                ps.setObject(1, from);
                ps.setObject(2, to);
                ps.setInt(3, limit);
                var out = new ArrayList<EventTypeCount>();
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new EventTypeCount(rs.getString(1), rs.getLong(2)));
                    }
                }
                return out;
            } catch (SQLException e) {
                throw new TransientException("Top events query failed", e);
            }
        });
    }

    @Override
    public Optional<RetentionCohort> retention(LocalDate start, int windows, WindowType windowType) {
        int days = windowType.days();
        LocalDate cohortEnd = start.plusDays(days);
        return connectionOps.executeRead(status -> {
            try {
                Connection c = status.getConnection();
                long cohort;
                try (var ps = c.prepareStatement(ACTIVE_USERS)) {
                    bindRange(ps, 1, start, cohortEnd);
                    cohort = count(ps);
                }
                if (cohort == 0) {
                    return Optional.<RetentionCohort>empty();
                }
                var percentages = new ArrayList<Double>(windows);
                try (var ps = c.prepareStatement(RETAINED_USERS)) {
                    bindRange(ps, 3, start, cohortEnd);
                    for (int i = 1; i <= windows; i++) {
                        LocalDate from = start.plusDays((long) i * days);
                        bindRange(ps, 1, from, from.plusDays(days));
                        percentages.add(percent(count(ps), cohort));
                    }
                }
                return Optional.of(new RetentionCohort(start, cohort, percentages));
            } catch (SQLException e) {
                throw new TransientException("Retention query failed", e);
            }
        });
    }

    private static void bindRange(PreparedStatement ps, int index, LocalDate from, LocalDate toExclusive) throws SQLException {
        ps.setObject(index, from);
        ps.setObject(index + 1, toExclusive);
    }

    private static long count(PreparedStatement ps) throws SQLException {
        try (var rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    static double percent(long part, long whole) {
        return BigDecimal.valueOf(part * 100L)
            .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
