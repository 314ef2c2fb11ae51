package com.beacon.notification.channel.handler;

import com.beacon.notification.common.message.PushChannelMessage;
import com.beacon.notification.common.messaging.MessageHandler;
import com.beacon.notification.common.provider.PermanentDeliveryException;
import com.beacon.notification.common.provider.PushProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PushMessageHandler implements MessageHandler<PushChannelMessage> {

    private final PushProvider pushProvider;
    private final ChannelDelivery channelDelivery;

    @Override
    public void process(PushChannelMessage message) {
        boolean hasTarget = (message.to() != null && !message.to().isBlank())
            || (message.condition() != null && !message.condition().isBlank());
        if (!hasTarget) {
            throw new PermanentDeliveryException("Push notification needs a device token or a condition");
        }
        channelDelivery.deliver(message, pushProvider.isConfigured(), pushProvider.getProviderName(), pushProvider::send);
    }
}
