package com.beacon.notification.common.retry;

/**
 * Classification of message delivery failures.
 * 
 * Used to decide whether a failed message may be attempted again:
 * - PERMANENT: never retried (invalid recipient, missing job, bad payload)
 * - TRANSIENT: retried with exponential backoff (timeouts, network errors, cancellation)
 * - RATE_LIMIT: retried with exponential backoff (provider throttling)
 * 
 * Shared by every consumer (email, SMS, push, bulk) so retry behavior is the same on all queues.
 */
public enum FailureClassification {
    PERMANENT,
    TRANSIENT,
    RATE_LIMIT;

    public boolean isRetryable() {
        return this != PERMANENT;
    }
}
