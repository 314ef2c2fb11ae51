package com.beacon.notification.common.messaging;

/**
 * Business logic invoked with a deserialized message. Throwing signals failure;
 * the failure's classification decides whether it is retried.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    void process(T message) throws Exception;
}
