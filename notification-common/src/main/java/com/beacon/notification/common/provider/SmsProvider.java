package com.beacon.notification.common.provider;

import com.beacon.notification.common.message.SmsChannelMessage;

/**
 * Sends a single SMS. A rejected number is a PERMANENT failure, a throttled account RATE_LIMITED.
 */
public interface SmsProvider {

    DeliveryResult send(SmsChannelMessage message);

    String getProviderName();

    default boolean isConfigured() {
        return true;
    }
}
