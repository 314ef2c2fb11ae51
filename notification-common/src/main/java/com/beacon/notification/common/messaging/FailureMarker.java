package com.beacon.notification.common.messaging;

/**
 * Marks the entity behind a message as Failed once its retries are exhausted.
 * 
 * Callers treat this as best-effort: any exception thrown here is logged and
 * swallowed so it never masks the original failure or blocks dead-lettering.
 */
@FunctionalInterface
public interface FailureMarker<T> {

    void markFailed(T message, Throwable cause) throws Exception;

    static <T> FailureMarker<T> none() {
        return (message, cause) -> { };
    }
}
