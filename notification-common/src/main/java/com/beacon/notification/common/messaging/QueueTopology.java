package com.beacon.notification.common.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

/**
 * Declares a main queue together with its dead-letter exchange and dead-letter queue.
 * 
 * <pre>
 * {queue}-dlx (direct, durable) --[routing key = {queue}]--> {queue}-dlq (durable)
 * {queue} (durable, x-dead-letter-exchange={queue}-dlx, x-dead-letter-routing-key={queue})
 * </pre>
 * 
 * A nack without requeue on the main queue therefore lands in the dead-letter queue.
 * Declarations are idempotent as long as the arguments do not change.
 */
@Slf4j
public final class QueueTopology {

    private QueueTopology() {
    }

    public static DirectExchange deadLetterExchange(String queueName) {
        return ExchangeBuilder.directExchange(QueueNames.deadLetterExchange(queueName))
            .durable(true)
            .build();
    }

    public static Queue deadLetterQueue(String queueName) {
        return QueueBuilder.durable(QueueNames.deadLetterQueue(queueName)).build();
    }

    public static Binding deadLetterBinding(String queueName) {
        return BindingBuilder.bind(deadLetterQueue(queueName))
            .to(deadLetterExchange(queueName))
            .with(queueName);
    }

    public static Queue mainQueue(String queueName) {
        return QueueBuilder.durable(queueName)
            .deadLetterExchange(QueueNames.deadLetterExchange(queueName))
            .deadLetterRoutingKey(queueName)
            .build();
    }

    /**
     * Declarables for a Spring bean, so the admin declares the topology on every (re)connect.
     */
    public static Declarables declarables(String queueName) {
        return new Declarables(
            deadLetterExchange(queueName),
            deadLetterQueue(queueName),
            deadLetterBinding(queueName),
            mainQueue(queueName));
    }

    public static void declare(AmqpAdmin amqpAdmin, String queueName) {
        amqpAdmin.declareExchange(deadLetterExchange(queueName));
        amqpAdmin.declareQueue(deadLetterQueue(queueName));
        amqpAdmin.declareBinding(deadLetterBinding(queueName));
        amqpAdmin.declareQueue(mainQueue(queueName));
        log.info("Declared queue {} with dead-letter queue {}", queueName, QueueNames.deadLetterQueue(queueName));
    }
}
