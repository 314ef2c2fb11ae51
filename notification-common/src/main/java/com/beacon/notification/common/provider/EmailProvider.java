package com.beacon.notification.common.provider;

import com.beacon.notification.common.message.EmailChannelMessage;

/**
 * Email provider interface.
 * 
 * Narrow send abstraction; vendor wire calls live behind implementations.
 * Failures should be reported through {@link DeliveryResult} with a category
 * rather than thrown, so the caller can decide whether to retry.
 */
public interface EmailProvider {

    DeliveryResult send(EmailChannelMessage message);

    String getProviderName();

    default boolean isConfigured() {
        return true;
    }
}
