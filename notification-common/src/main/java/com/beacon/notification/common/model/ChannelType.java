package com.beacon.notification.common.model;

import java.util.Locale;

/**
 * Delivery channel of a notification. Each channel owns one main queue.
 */
public enum ChannelType {
    EMAIL("email"),
    SMS("sms"),
    PUSH("push");

    private final String queuePrefix;

    ChannelType(String queuePrefix) {
        this.queuePrefix = queuePrefix;
    }

    public String getQueuePrefix() {
        return queuePrefix;
    }

    /**
     * Parse a stored channel value (case-insensitive).
     *
     * @throws UnsupportedChannelException when the value names no known channel
     */
    public static ChannelType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new UnsupportedChannelException(value);
        }
        try {
            return ChannelType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedChannelException(value);
        }
    }
}
