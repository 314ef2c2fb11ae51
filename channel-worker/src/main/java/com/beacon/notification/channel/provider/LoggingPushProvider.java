package com.beacon.notification.channel.provider;

import com.beacon.notification.common.message.PushChannelMessage;
import com.beacon.notification.common.provider.DeliveryResult;
import com.beacon.notification.common.provider.PushProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingPushProvider implements PushProvider {

    private final ProviderProperties properties;

    @Override
    public DeliveryResult send(PushChannelMessage message) {
        String title = message.content() != null ? message.content().title() : null;
        log.info("Push ({}) to {} title '{}' with {} data entries",
            message.platform(), message.to() != null ? message.to() : message.condition(), title, message.data().size());
        return DeliveryResult.createSuccess(UUID.randomUUID().toString());
    }

    @Override
    public String getProviderName() {
        return properties.getPush().getName();
    }

    @Override
    public boolean isConfigured() {
        return properties.getPush().isEnabled();
    }
}
