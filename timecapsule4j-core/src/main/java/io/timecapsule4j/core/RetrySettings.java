package io.timecapsule4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-count, fixed-delay retry used by stores when requeueing a premature pop and when
 * removing a delivered capsule.
 */
public record RetrySettings(int limit, Duration interval) {

    public static final int DEFAULT_LIMIT = 100;
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(10);

    public RetrySettings {
        Objects.requireNonNull(interval, "interval must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(DEFAULT_LIMIT, DEFAULT_INTERVAL);
    }
}
