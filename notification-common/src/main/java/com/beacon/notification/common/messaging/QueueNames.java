package com.beacon.notification.common.messaging;

import com.beacon.notification.common.model.ChannelType;

import java.util.List;

/**
 * Queue naming convention: main queue {@code {channel}-notifications},
 * dead-letter exchange {@code {queue}-dlx}, dead-letter queue {@code {queue}-dlq}.
 */
public final class QueueNames {

    public static final String EMAIL = "email-notifications";
    public static final String SMS = "sms-notifications";
    public static final String PUSH = "push-notifications";
    public static final String BULK = "bulk-notifications";

    private static final String DLX_SUFFIX = "-dlx";
    private static final String DLQ_SUFFIX = "-dlq";

    private QueueNames() {
    }

    public static String forChannel(ChannelType channel) {
        return switch (channel) {
            case EMAIL -> EMAIL;
            case SMS -> SMS;
            case PUSH -> PUSH;
        };
    }

    public static String deadLetterExchange(String queueName) {
        return queueName + DLX_SUFFIX;
    }

    public static String deadLetterQueue(String queueName) {
        return queueName + DLQ_SUFFIX;
    }

    public static boolean isDeadLetterQueue(String queueName) {
        return queueName != null && queueName.endsWith(DLQ_SUFFIX);
    }

    /**
     * Main queue a dead-letter queue belongs to, e.g. {@code email-notifications-dlq -> email-notifications}.
     */
    public static String originalQueue(String deadLetterQueue) {
        if (!isDeadLetterQueue(deadLetterQueue)) {
            throw new IllegalArgumentException("Not a dead-letter queue: " + deadLetterQueue);
        }
        return deadLetterQueue.substring(0, deadLetterQueue.length() - DLQ_SUFFIX.length());
    }

    public static List<String> mainQueues() {
        return List.of(EMAIL, SMS, PUSH, BULK);
    }

    public static List<String> deadLetterQueues() {
        return mainQueues().stream().map(QueueNames::deadLetterQueue).toList();
    }
}
