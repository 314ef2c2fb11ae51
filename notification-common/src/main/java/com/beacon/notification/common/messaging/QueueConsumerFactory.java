package com.beacon.notification.common.messaging;

import com.beacon.notification.common.retry.ExponentialBackoffRetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;

/**
 * Builds a {@link QueueConsumer} and the listener container that runs it.
 * 
 * Every container consumes a single queue with one consumer thread, manual
 * acknowledgement and the configured prefetch. Containers are Spring lifecycle
 * beans: on shutdown they stop consuming and wait up to {@code shutdown-timeout}
 * for the in-flight message before closing the channel.
 */
@Slf4j
@RequiredArgsConstructor
public class QueueConsumerFactory {

    private final ConnectionFactory connectionFactory;
    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final MessagingProperties properties;

    public <T> QueueConsumer<T> createConsumer(String queueName, Class<T> messageType,
                                               MessageHandler<T> handler, FailureMarker<T> failureMarker) {
        QueueConsumer.Builder<T> builder = QueueConsumer.builder(queueName, messageType)
            .handler(handler)
            .failureMarker(failureMarker)
            .maxAttempts(properties.getQueueMaxAttempts())
            .objectMapper(objectMapper)
            .rabbitTemplate(rabbitTemplate)
            .metrics(new QueueConsumerMetrics(meterRegistry, queueName));

        MessagingProperties.InProcessRetry retry = properties.getInProcessRetry();
        if (retry.isEnabled()) {
            builder.middleware(new ProcessingMiddleware(new ExponentialBackoffRetryPolicy(
                retry.getMaxRetries(), retry.getInitialDelay(), retry.getMaxDelay())));
        }
        return builder.build();
    }

    public SimpleMessageListenerContainer createContainer(QueueConsumer<?> consumer) {
        SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(connectionFactory);
        container.setQueueNames(consumer.getQueueName());
        container.setMessageListener(consumer);
        container.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        container.setConcurrentConsumers(1);
        container.setMaxConcurrentConsumers(1);
        container.setPrefetchCount(properties.getPrefetch());
        container.setDefaultRequeueRejected(false);
        container.setShutdownTimeout(properties.getShutdownTimeout().toMillis());
        log.info("Created consumer container for queue {} (max attempts {}, in-process retry {})",
            consumer.getQueueName(), properties.getQueueMaxAttempts(), properties.getInProcessRetry().isEnabled());
        return container;
    }

    public <T> SimpleMessageListenerContainer createContainer(String queueName, Class<T> messageType,
                                                              MessageHandler<T> handler, FailureMarker<T> failureMarker) {
        return createContainer(createConsumer(queueName, messageType, handler, failureMarker));
    }
}
