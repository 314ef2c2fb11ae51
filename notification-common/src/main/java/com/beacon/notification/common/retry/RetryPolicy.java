package com.beacon.notification.common.retry;

import java.time.Duration;

/**
 * Decides whether a failed attempt may be retried and how long to wait first.
 * Implementations are pure: no I/O and no state changes.
 */
public interface RetryPolicy {

    /**
     * @param attempt zero-based number of retries already performed
     * @param failure the failure raised by the last attempt
     * @return true when another attempt is allowed
     */
    boolean shouldRetry(int attempt, Throwable failure);

    /**
     * @param attempt zero-based number of retries already performed
     * @return wait before the next attempt
     */
    Duration retryDelay(int attempt);

    int maxRetries();

    static RetryPolicy noRetry() {
        return new ExponentialBackoffRetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }
}
