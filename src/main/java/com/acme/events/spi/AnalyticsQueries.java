package com.acme.events.spi;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only aggregate queries over stored events. Date ranges are inclusive, in UTC.
 */
public interface AnalyticsQueries {
    List<DailyActiveUsers> dailyActiveUsers(LocalDate from, LocalDate to);

    List<EventTypeCount> topEvents(LocalDate from, LocalDate to, int limit);

    /**
     * @return empty when nobody was active in the first window
     */
    Optional<RetentionCohort> retention(LocalDate start, int windows, WindowType windowType);

    record DailyActiveUsers(LocalDate date, long uniqueUsers) {}

    record EventTypeCount(String eventType, long count) {}

    record RetentionCohort(LocalDate cohortDate, long usersCount, List<Double> retentionWindows) {}

    enum WindowType {
        DAY(1), WEEK(7);

        private final int days;

        WindowType(int days) {
            this.days = days;
        }

        public int days() {
            return days;
        }

        public static WindowType parse(String raw) {
            for (var t : values()) {
                if (t.name().equalsIgnoreCase(raw)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("window_type must be 'day' or 'week'");
        }
    }
}
