package com.beacon.notification.service.deadletter;

import com.beacon.notification.common.messaging.MessageHeaders;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.LongString;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator operations on dead-letter queues: stats, peek, reprocess and purge.
 * 
 * Every operation runs on a single broker channel so delivery tags obtained by
 * {@code basicGet} stay valid until they are acked or nacked. Results are snapshots:
 * producers and consumers working on the same queue concurrently can interleave
 * with a peek or a reprocess-all, and no stronger consistency is attempted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final RabbitTemplate rabbitTemplate;
    private final DeadLetterProperties properties;
    private final Clock clock;

    /**
     * Message and consumer counts of every configured dead-letter queue.
     * A queue that cannot be inspected is logged and left out.
     */
    public List<DeadLetterQueueStats> stats() {
        List<DeadLetterQueueStats> stats = new ArrayList<>();
        for (String queueName : properties.getQueues()) {
            try {
                AMQP.Queue.DeclareOk declared = rabbitTemplate.execute(channel -> declare(channel, queueName));
                stats.add(new DeadLetterQueueStats(queueName, declared.getMessageCount(), declared.getConsumerCount()));
            } catch (AmqpException e) {
                log.error("Error getting stats for queue {}", queueName, e);
            }
        }
        return stats;
    }

    /**
     * Lists up to {@code limit} messages without removing them. Each message is fetched
     * unacknowledged and then nacked with requeue.
     */
    public List<DeadLetterMessage> peek(String queueName, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return rabbitTemplate.execute(channel -> {
            int available = declare(channel, queueName).getMessageCount();
            int toRead = Math.min(limit, available);
            List<DeadLetterMessage> messages = new ArrayList<>(toRead);
            List<Long> deliveryTags = new ArrayList<>(toRead);
            try {
                for (int i = 0; i < toRead; i++) {
                    GetResponse response = channel.basicGet(queueName, false);
                    if (response == null) {
                        break;
                    }
                    deliveryTags.add(response.getEnvelope().getDeliveryTag());
                    messages.add(toDeadLetterMessage(queueName, response));
                }
            } finally {
                for (Long deliveryTag : deliveryTags) {
                    channel.basicNack(deliveryTag, false, true);
                }
            }
            log.debug("Peeked {} message(s) from {}", messages.size(), queueName);
            return messages;
        });
    }

    /**
     * Moves the message at the head of {@code deadLetterQueue} back to {@code originalQueue}
     * with {@code retry-count} reset to 0 and reprocessing headers stamped.
     * 
     * The delivery tag from a previous peek is only used for logging: tags are scoped to
     * the channel that fetched the message, so the head of the queue is taken instead.
     *
     * @return false when the dead-letter queue was empty
     */
    public boolean reprocessOne(String deadLetterQueue, String originalQueue, long deliveryTag) {
        Boolean moved = rabbitTemplate.execute(channel -> {
            GetResponse response = channel.basicGet(deadLetterQueue, false);
            if (response == null) {
                log.warn("Message with delivery tag {} not found in {}", deliveryTag, deadLetterQueue);
                return false;
            }
            moveToOriginal(channel, response, originalQueue);
            return true;
        });
        if (Boolean.TRUE.equals(moved)) {
            log.info("Message reprocessed from {} to {}", deadLetterQueue, originalQueue);
            return true;
        }
        return false;
    }

    /**
     * Reprocesses as many messages as the dead-letter queue held when the call started.
     * Messages dead-lettered during the loop may or may not be included.
     *
     * @return number of messages moved
     */
    public int reprocessAll(String deadLetterQueue, String originalQueue) {
        Integer moved = rabbitTemplate.execute(channel -> {
            int snapshot = declare(channel, deadLetterQueue).getMessageCount();
            log.info("Reprocessing {} messages from {} to {}", snapshot, deadLetterQueue, originalQueue);
            int count = 0;
            for (int i = 0; i < snapshot; i++) {
                GetResponse response = channel.basicGet(deadLetterQueue, false);
                if (response == null) {
                    break;
                }
                moveToOriginal(channel, response, originalQueue);
                count++;
            }
            return count;
        });
        int total = moved != null ? moved : 0;
        log.info("Reprocessed {} messages from {}", total, deadLetterQueue);
        return total;
    }

    /**
     * Deletes every message currently in the queue. Irreversible.
     *
     * @return number of messages purged
     */
    public int purge(String queueName) {
        Integer purged = rabbitTemplate.execute(channel -> channel.queuePurge(queueName).getMessageCount());
        int total = purged != null ? purged : 0;
        log.info("Purged {} messages from {}", total, queueName);
        return total;
    }

    private void moveToOriginal(Channel channel, GetResponse response, String originalQueue) throws IOException {
        Map<String, Object> headers = new HashMap<>();
        headers.put(MessageHeaders.RETRY_COUNT, 0);
        headers.put(MessageHeaders.REPROCESSED_FROM_DLQ, true);
        headers.put(MessageHeaders.REPROCESSED_AT, clock.instant().getEpochSecond());

        AMQP.BasicProperties original = response.getProps();
        AMQP.BasicProperties republished = new AMQP.BasicProperties.Builder()
            .contentType(original != null && original.getContentType() != null
                ? original.getContentType() : MessageProperties.CONTENT_TYPE_JSON)
            .contentEncoding(original != null ? original.getContentEncoding() : null)
            .deliveryMode(2)
            .headers(headers)
            .build();

        channel.basicPublish("", originalQueue, republished, response.getBody());
        channel.basicAck(response.getEnvelope().getDeliveryTag(), false);
    }

    private static AMQP.Queue.DeclareOk declare(Channel channel, String queueName) throws IOException {
        return channel.queueDeclare(queueName, true, false, false, null);
    }

    private static DeadLetterMessage toDeadLetterMessage(String queueName, GetResponse response) {
        AMQP.BasicProperties props = response.getProps();
        Map<String, Object> headers = new LinkedHashMap<>();
        if (props != null && props.getHeaders() != null) {
            props.getHeaders().forEach((key, value) -> headers.put(key, readable(value)));
        }
        Instant timestamp = props != null && props.getTimestamp() != null
            ? props.getTimestamp().toInstant() : null;
        return new DeadLetterMessage(
            queueName,
            new String(response.getBody(), StandardCharsets.UTF_8),
            response.getEnvelope().getDeliveryTag(),
            timestamp,
            headers,
            deathReason(props),
            MessageHeaders.retryCount(props != null ? props.getHeaders() : null));
    }

    private static String deathReason(AMQP.BasicProperties props) {
        if (props == null || props.getHeaders() == null) {
            return null;
        }
        Object deaths = props.getHeaders().get(MessageHeaders.X_DEATH);
        if (deaths instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Map<?, ?> first) {
            Object reason = first.get("reason");
            return reason != null ? reason.toString() : null;
        }
        return null;
    }

    // raw client headers carry LongString values
    private static Object readable(Object value) {
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(item -> converted.add(readable(item)));
            return converted;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> converted.put(String.valueOf(k), readable(v)));
            return converted;
        }
        if (value instanceof LongString longString) {
            return longString.toString();
        }
        return value;
    }
}
