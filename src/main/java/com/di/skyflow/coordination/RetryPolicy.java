package com.di.skyflow.coordination;

import java.time.Duration;

/**
 * Exponential backoff: the wait after the n-th failed attempt is
 * {@code min(baseDelay * 2^(n-1), maxDelay)}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    /**
     * @param failedAttempts number of attempts that have failed so far (1-based)
     */
    public Duration delayAfter(int failedAttempts) {
        int exponent = Math.min(Math.max(failedAttempts - 1, 0), 30);
        long millis = baseDelay.toMillis() * (1L << exponent);
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }
}
