package com.beacon.notification.common.retry;

import java.time.Duration;

/**
 * Exponential backoff: delay(attempt) = min(initialDelay * 2^attempt, maxDelay).
 * Only transient failures are retried, and never once {@code maxRetries} is reached.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;

    public ExponentialBackoffRetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (initialDelay == null || initialDelay.isNegative() || maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must be non-negative");
        }
        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public static ExponentialBackoffRetryPolicy defaults() {
        return new ExponentialBackoffRetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
    }

    @Override
    public boolean shouldRetry(int attempt, Throwable failure) {
        if (attempt >= maxRetries) {
            return false;
        }
        return FailureClassifier.isTransient(failure);
    }

    @Override
    public Duration retryDelay(int attempt) {
        if (attempt <= 0) {
            return min(initialDelay, maxDelay);
        }
        // 2^62 ms is already far beyond any sane cap
        if (attempt >= 62) {
            return maxDelay;
        }
        long factor = 1L << attempt;
        long initialMillis = initialDelay.toMillis();
        if (initialMillis != 0 && factor > Long.MAX_VALUE / initialMillis) {
            return maxDelay;
        }
        return min(Duration.ofMillis(initialMillis * factor), maxDelay);
    }

    @Override
    public int maxRetries() {
        return maxRetries;
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryPolicy{maxRetries=" + maxRetries
                + ", initialDelay=" + initialDelay + ", maxDelay=" + maxDelay + '}';
    }
}
