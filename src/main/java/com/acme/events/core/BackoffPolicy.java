package com.acme.events.core;

import com.acme.events.config.RetryConfig;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;

/**
 * Exponential backoff: {@code delay(attempt) = unit * base^attempt}.
 *
 * <p>The base must be at least 2 so that delays are strictly increasing. No jitter is applied.
 */
@Singleton
public class BackoffPolicy {

    private final int base;
    private final Duration unit;

    @Inject
    public BackoffPolicy(RetryConfig config) {
        this(config.getBackoffBase(), config.getBackoffUnit());
    }

    public BackoffPolicy(int base, Duration unit) {
        if (base < 2) {
            throw new IllegalArgumentException("Backoff base must be >= 2, was " + base);
        }
        if (unit == null || unit.isNegative() || unit.isZero()) {
            throw new IllegalArgumentException("Backoff unit must be positive");
        }
        this.base = base;
        this.unit = unit;
    }

    /**
     * @param attempt retry attempt, starting at 1 for the first retry
     * @throws ArithmeticException if the delay does not fit in a {@link Duration}
     */
    public Duration delay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
        long factor = 1;
        for (int i = 0; i < attempt; i++) {
            factor = Math.multiplyExact(factor, base);
        }
        return unit.multipliedBy(factor);
    }

    public int base() {
        return base;
    }
}
