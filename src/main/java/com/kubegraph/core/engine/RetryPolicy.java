package com.kubegraph.core.engine;

import com.kubegraph.core.config.KubegraphProperties;

import java.time.Duration;

/**
 * Exponential backoff for transient apply failures.
 *
 * @param maxRetries retries after the first attempt
 */
public record RetryPolicy(int maxRetries, double backoffMultiplier, Duration initialDelay, Duration maxDelay) {

    public static final RetryPolicy DEFAULT =
            new RetryPolicy(3, 2.0, Duration.ofSeconds(1), Duration.ofSeconds(10));

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, 1.0, Duration.ZERO, Duration.ZERO);
    }

    public static RetryPolicy from(KubegraphProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxRetries(), retry.getBackoffMultiplier(),
                Duration.ofMillis(retry.getInitialDelayMs()), Duration.ofMillis(retry.getMaxDelayMs()));
    }

    /** Delay before retry number {@code attempt + 1}, where attempt 0 is the first failure. */
    public Duration delayFor(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, attempt);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }
}
