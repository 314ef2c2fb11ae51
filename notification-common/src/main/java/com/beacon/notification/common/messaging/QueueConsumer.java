package com.beacon.notification.common.messaging;

import com.beacon.notification.common.retry.FailureClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.MessagePropertiesBuilder;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

import java.io.IOException;

/**
 * Generic consumer for one logical queue, composed from an injected
 * {@link MessageHandler} and {@link FailureMarker}.
 * 
 * Per delivery:
 * - body cannot be deserialized: nack without requeue, the queue's dead-letter binding
 *   moves it to the DLQ; never retried, no entity is marked
 * - handler succeeds: ack
 * - handler fails with a transient error and {@code retry-count < maxAttempts - 1}:
 *   republish the original body to the same queue with {@code retry-count + 1}, then ack
 * - otherwise: mark the entity Failed (best-effort), then nack without requeue
 * 
 * Must run with manual acknowledgement. One consumer thread per queue, so messages
 * of a queue are handled one at a time.
 */
@Slf4j
public class QueueConsumer<T> implements ChannelAwareMessageListener {

    private final String queueName;
    private final Class<T> messageType;
    private final MessageHandler<T> handler;
    private final FailureMarker<T> failureMarker;
    private final int maxAttempts;
    private final ObjectMapper objectMapper;
    private final RabbitTemplate rabbitTemplate;
    private final ProcessingMiddleware middleware;
    private final QueueConsumerMetrics metrics;

    QueueConsumer(Builder<T> builder) {
        this.queueName = builder.queueName;
        this.messageType = builder.messageType;
        this.handler = builder.handler;
        this.failureMarker = builder.failureMarker != null ? builder.failureMarker : FailureMarker.none();
        this.maxAttempts = builder.maxAttempts;
        this.objectMapper = builder.objectMapper;
        this.rabbitTemplate = builder.rabbitTemplate;
        this.middleware = builder.middleware;
        this.metrics = builder.metrics;
    }

    public static <T> Builder<T> builder(String queueName, Class<T> messageType) {
        return new Builder<>(queueName, messageType);
    }

    public String getQueueName() {
        return queueName;
    }

    @Override
    public void onMessage(Message message, Channel channel) throws Exception {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();

        T payload;
        try {
            payload = objectMapper.readValue(message.getBody(), messageType);
        } catch (IOException e) {
            log.error("Malformed message on queue {}, rejecting without retry: {}", queueName, e.getMessage());
            channel.basicNack(deliveryTag, false, false);
            record(QueueConsumerMetrics.Outcome.MALFORMED);
            return;
        }

        Throwable failure = invokeHandler(payload);
        if (failure == null) {
            channel.basicAck(deliveryTag, false);
            record(QueueConsumerMetrics.Outcome.SUCCEEDED);
            return;
        }

        int retryCount = MessageHeaders.retryCount(message.getMessageProperties());
        if (retryCount < maxAttempts - 1 && FailureClassifier.isTransient(failure)) {
            if (republish(message, retryCount + 1)) {
                channel.basicAck(deliveryTag, false);
                log.warn("Processing failed on queue {}, requeued for attempt {}/{}: {}",
                    queueName, retryCount + 2, maxAttempts, failure.getMessage());
                record(QueueConsumerMetrics.Outcome.RETRIED);
                return;
            }
        }

        log.error("Processing failed on queue {} after {} attempt(s), dead-lettering: {}",
            queueName, retryCount + 1, failure.getMessage(), failure);
        FailureMarkers.markQuietly(failureMarker, payload, failure);
        channel.basicNack(deliveryTag, false, false);
        record(QueueConsumerMetrics.Outcome.DEAD_LETTERED);
    }

    private Throwable invokeHandler(T payload) {
        if (middleware != null) {
            // the consumer owns the mark-Failed step, after the queue-level decision
            ProcessingResult result = middleware.execute(payload, handler, FailureMarker.none());
            return result.isSuccess() ? null : result.getError();
        }
        try {
            handler.process(payload);
            return null;
        } catch (Exception e) {
            return e;
        }
    }

    private boolean republish(Message original, int nextRetryCount) {
        MessageProperties properties = MessagePropertiesBuilder
            .fromClonedProperties(original.getMessageProperties())
            .setHeader(MessageHeaders.RETRY_COUNT, nextRetryCount)
            .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
            .build();
        try {
            rabbitTemplate.send("", queueName, new Message(original.getBody(), properties));
            return true;
        } catch (AmqpException e) {
            log.error("Failed to republish message to queue {}, falling back to dead-letter", queueName, e);
            return false;
        }
    }

    private void record(QueueConsumerMetrics.Outcome outcome) {
        if (metrics != null) {
            metrics.record(outcome);
        }
    }

    public static final class Builder<T> {

        private final String queueName;
        private final Class<T> messageType;
        private MessageHandler<T> handler;
        private FailureMarker<T> failureMarker;
        private int maxAttempts = 3;
        private ObjectMapper objectMapper;
        private RabbitTemplate rabbitTemplate;
        private ProcessingMiddleware middleware;
        private QueueConsumerMetrics metrics;

        private Builder(String queueName, Class<T> messageType) {
            this.queueName = queueName;
            this.messageType = messageType;
        }

        public Builder<T> handler(MessageHandler<T> handler) {
            this.handler = handler;
            return this;
        }

        public Builder<T> failureMarker(FailureMarker<T> failureMarker) {
            this.failureMarker = failureMarker;
            return this;
        }

        public Builder<T> maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder<T> objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder<T> rabbitTemplate(RabbitTemplate rabbitTemplate) {
            this.rabbitTemplate = rabbitTemplate;
            return this;
        }

        public Builder<T> middleware(ProcessingMiddleware middleware) {
            this.middleware = middleware;
            return this;
        }

        public Builder<T> metrics(QueueConsumerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public QueueConsumer<T> build() {
            if (queueName == null || messageType == null || handler == null
                    || objectMapper == null || rabbitTemplate == null) {
                throw new IllegalStateException("queueName, messageType, handler, objectMapper and rabbitTemplate are required");
            }
            if (maxAttempts < 1) {
                throw new IllegalStateException("maxAttempts must be at least 1: " + maxAttempts);
            }
            return new QueueConsumer<>(this);
        }
    }
}
