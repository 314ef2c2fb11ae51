package com.beacon.notification.common.provider;

import com.beacon.notification.common.message.PushChannelMessage;

public interface PushProvider {

    DeliveryResult send(PushChannelMessage message);

    String getProviderName();

    default boolean isConfigured() {
        return true;
    }
}
