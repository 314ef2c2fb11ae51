package com.beacon.notification.service.deadletter;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of one message sitting in a dead-letter queue.
 *
 * @param errorReason broker's dead-letter reason from {@code x-death} ("rejected", "expired"), if present
 */
public record DeadLetterMessage(
    String queueName,
    String messageBody,
    long deliveryTag,
    Instant timestamp,
    Map<String, Object> headers,
    String errorReason,
    int retryCount
) {
}
