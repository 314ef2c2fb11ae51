package com.beacon.notification.service.deadletter;

public record DeadLetterQueueStats(String queueName, long messageCount, long consumerCount) {
}
