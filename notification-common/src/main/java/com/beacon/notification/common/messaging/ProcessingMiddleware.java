package com.beacon.notification.common.messaging;

import com.beacon.notification.common.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * In-process retry wrapper: bounded immediate retries with backoff, without going
 * back through the broker.
 * 
 * The wait blocks the calling consumer thread, so a queue stalls while one of its
 * messages backs off. Interrupting the thread (container shutdown) ends the wait
 * promptly and the last failure is reported.
 */
@Slf4j
public class ProcessingMiddleware {

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public ProcessingMiddleware(RetryPolicy retryPolicy) {
        this(retryPolicy, Sleeper.THREAD);
    }

    public ProcessingMiddleware(RetryPolicy retryPolicy, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public <T> ProcessingResult execute(T message, MessageHandler<T> handler, FailureMarker<T> failureMarker) {
        int attempt = 0;
        while (true) {
            Exception failure;
            try {
                handler.process(message);
                return ProcessingResult.success();
            } catch (Exception e) {
                failure = e;
            }

            if (!retryPolicy.shouldRetry(attempt, failure)) {
                log.error("Processing of {} failed after {} retries: {}",
                    describe(message), attempt, failure.getMessage(), failure);
                return fail(message, failure, failureMarker);
            }

            Duration delay = retryPolicy.retryDelay(attempt);
            log.warn("Processing of {} failed, retrying in {} ms (retry {}/{}): {}",
                describe(message), delay.toMillis(), attempt + 1, retryPolicy.maxRetries(), failure.getMessage());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry wait for {} interrupted, giving up", describe(message));
                return fail(message, failure, failureMarker);
            }
            attempt++;
        }
    }

    private <T> ProcessingResult fail(T message, Throwable failure, FailureMarker<T> failureMarker) {
        FailureMarkers.markQuietly(failureMarker, message, failure);
        return ProcessingResult.failure(failure);
    }

    private static String describe(Object message) {
        return message == null ? "null" : message.getClass().getSimpleName();
    }
}
