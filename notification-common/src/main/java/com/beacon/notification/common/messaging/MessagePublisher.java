package com.beacon.notification.common.messaging;

/**
 * Publishes a message to a queue. Fire-and-forget from the caller's perspective;
 * durability comes from the persistent delivery mode and durable queues.
 */
public interface MessagePublisher {

    void publish(String queueName, Object message);
}
