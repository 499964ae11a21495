package com.phillippitts.edgekeeper.service.telemetry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential retry schedule: attempt {@code n} waits {@code initialDelay * 2^(n-1)} before
 * attempt {@code n+1}.
 *
 * @param maxAttempts total attempts per delivery (at least 1)
 * @param initialDelay delay after the first failed attempt
 */
public record RetryBackoff(int maxAttempts, Duration initialDelay) {

    public RetryBackoff {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(initialDelay, "initialDelay");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
    }

    /**
     * Delay to wait after failed attempt number {@code attempt} (1-based).
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        int shift = Math.min(attempt - 1, 30);
        return initialDelay.multipliedBy(1L << shift);
    }

    public boolean hasNext(int attempt) {
        return attempt < maxAttempts;
    }
}
