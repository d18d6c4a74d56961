package com.acme.events.web;

import com.acme.events.core.Jsons;
import com.acme.events.core.TransientException;
import com.acme.events.spi.AnalyticsQueries;
import com.acme.events.spi.AnalyticsQueries.WindowType;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.QueryValue;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only analytics over stored events. Dates are ISO {@code yyyy-MM-dd}, inclusive, UTC.
 */
@Controller(value = "/stats", produces = MediaType.APPLICATION_JSON)
public class StatsController {
    private static final Logger LOG = LoggerFactory.getLogger(StatsController.class);

    static final int MAX_LIMIT = 1000;
    static final int MAX_WINDOWS = 52;

    private final AnalyticsQueries queries;

    public StatsController(AnalyticsQueries queries) {
        this.queries = queries;
    }

    @Get("/dau")
    public HttpResponse<?> dau(@QueryValue("from_date") String fromDate, @QueryValue("to_date") String toDate) {
        return respond(() -> {
            var from = date("from_date", fromDate);
            var to = date("to_date", toDate);
            requireOrdered(from, to);
            var rows = queries.dailyActiveUsers(from, to).stream()
                .map(r -> new DauRow(r.date(), r.uniqueUsers()))
                .toList();
            return new Data<>(rows);
        });
    }

    @Get("/top-events")
    public HttpResponse<?> topEvents(@QueryValue("from_date") String fromDate,
                                     @QueryValue("to_date") String toDate,
                                     @QueryValue(value = "limit", defaultValue = "10") int limit) {
        return respond(() -> {
            var from = date("from_date", fromDate);
            var to = date("to_date", toDate);
            requireOrdered(from, to);
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
            }
            var rows = queries.topEvents(from, to, limit).stream()
                .map(r -> new TopEventRow(r.eventType(), r.count()))
                .toList();
            return new Data<>(rows);
        });
    }

    @Get("/retention")
    public HttpResponse<?> retention(@QueryValue("start_date") String startDate,
                                     @QueryValue(value = "windows", defaultValue = "3") int windows,
                                     @QueryValue(value = "window_type", defaultValue = "day") String windowType) {
        return respond(() -> {
            var start = date("start_date", startDate);
            if (windows < 1 || windows > MAX_WINDOWS) {
                throw new IllegalArgumentException("windows must be between 1 and " + MAX_WINDOWS);
            }
            var type = WindowType.parse(windowType);
            String typeName = type.name().toLowerCase();
            return queries.retention(start, windows, type)
                .map(c -> new Retention(List.of(new CohortRow(c.cohortDate(), c.usersCount(), c.retentionWindows())), typeName))
                .orElseGet(() -> new Retention(List.of(), typeName));
        });
    }

    private HttpResponse<?> respond(Supplier<Object> query) {
        try {
            return HttpResponse.ok(Jsons.toJson(query.get()));
        } catch (IllegalArgumentException e) {
            return HttpResponse.badRequest(Jsons.error(e.getMessage()));
        } catch (TransientException e) {
            LOG.error("Analytics query failed", e);
            return HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Jsons.error("Database unavailable"));
        }
    }

    private static LocalDate date(String name, String raw) {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be a date in YYYY-MM-DD format", e);
        }
    }

    private static void requireOrdered(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from_date must be before or equal to to_date");
        }
    }

    record Data<T>(List<T> data) {}

    record DauRow(LocalDate date, @JsonProperty("unique_users") long uniqueUsers) {}

    record TopEventRow(@JsonProperty("event_type") String eventType, long count) {}

    record CohortRow(@JsonProperty("cohort_date") LocalDate cohortDate,
                     @JsonProperty("users_count") long usersCount,
                     @JsonProperty("retention_windows") List<Double> retentionWindows) {}

    record Retention(List<CohortRow> data, @JsonProperty("window_type") String windowType) {}
}
