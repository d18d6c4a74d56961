package com.acme.events.web;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestMetricsTest {

    @Test
    void testSlidingHourWindow() {
        var now = new AtomicReference<>(Instant.parse("2025-10-20T10:00:00Z"));
        var clock = new Clock() {
            @Override
            public ZoneOffset getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(java.time.ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return now.get();
            }
        };
        var metrics = new RequestMetrics(clock);

        assertEquals(1, metrics.record());
        now.set(now.get().plus(Duration.ofMinutes(30)));
        assertEquals(2, metrics.record());
        now.set(now.get().plus(Duration.ofMinutes(31)));
        assertEquals(1, metrics.lastHour());
        assertEquals(2, metrics.record());
    }
}
