package com.acme.events.web;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Counts requests over a sliding one-hour window.
 */
@Singleton
public class RequestMetrics {
    static final Duration WINDOW = Duration.ofHours(1);

    private final Clock clock;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    @Inject
    public RequestMetrics() {
        this(Clock.systemUTC());
    }

    RequestMetrics(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return requests seen in the last hour, this one included
     */
    public synchronized int record() {
        long now = clock.millis();
        timestamps.addLast(now);
        evict(now);
        return timestamps.size();
    }

    public synchronized int lastHour() {
        evict(clock.millis());
        return timestamps.size();
    }

    private void evict(long now) {
        long cutoff = now - WINDOW.toMillis();
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.removeFirst();
        }
    }
}
