package com.beacon.notification.common.messaging;

import org.springframework.amqp.core.MessageProperties;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Header names of the message envelope and helpers to read them.
 * 
 * {@code retry-count} is the only header the consumers inspect. It is absent on a
 * freshly published message (read as 0), incremented by one on every queue-level retry
 * and reset to 0 when an operator reprocesses a message from a dead-letter queue.
 */
public final class MessageHeaders {

    public static final String RETRY_COUNT = "retry-count";
    public static final String REPROCESSED_FROM_DLQ = "reprocessed-from-dlq";
    public static final String REPROCESSED_AT = "reprocessed-at";

    /** Set by the broker on dead-lettered messages. */
    public static final String X_DEATH = "x-death";

    private MessageHeaders() {
    }

    public static int retryCount(MessageProperties properties) {
        return properties == null ? 0 : retryCount(properties.getHeaders());
    }

    /**
     * Read {@code retry-count} from a header map.
     * Numbers, numeric strings and 4/8-byte big-endian arrays are accepted;
     * missing, unreadable or negative values read as 0.
     */
    public static int retryCount(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        Object value = headers.get(RETRY_COUNT);
        long count;
        if (value instanceof Number number) {
            count = number.longValue();
        } else if (value instanceof byte[] bytes) {
            count = fromBytes(bytes);
        } else if (value != null) {
            count = fromString(value.toString());
        } else {
            count = 0;
        }
        if (count < 0 || count > Integer.MAX_VALUE) {
            return 0;
        }
        return (int) count;
    }

    private static long fromBytes(byte[] bytes) {
        if (bytes.length == Integer.BYTES) {
            return ByteBuffer.wrap(bytes).getInt();
        }
        if (bytes.length == Long.BYTES) {
            return ByteBuffer.wrap(bytes).getLong();
        }
        return fromString(new String(bytes, StandardCharsets.UTF_8));
    }

    private static long fromString(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
