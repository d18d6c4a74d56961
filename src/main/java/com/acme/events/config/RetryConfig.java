package com.acme.events.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

/**
 * Retry budget and backoff settings for the event consumer.
 */
@ConfigurationProperties("retry")
public class RetryConfig {

    public static final int DEFAULT_BUDGET = 5;
    public static final int DEFAULT_BACKOFF_BASE = 5;

    private int budget = DEFAULT_BUDGET;
    private int backoffBase = DEFAULT_BACKOFF_BASE;
    private Duration backoffUnit = Duration.ofSeconds(1);

    /**
     * Highest attempt_count a message may carry before it goes to the dead-letter subject.
     */
    public int getBudget() {
        return budget;
    }

    public void setBudget(int budget) {
        this.budget = budget;
    }

    public int getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(int backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffUnit() {
        return backoffUnit;
    }

    public void setBackoffUnit(Duration backoffUnit) {
        this.backoffUnit = backoffUnit;
    }
}
