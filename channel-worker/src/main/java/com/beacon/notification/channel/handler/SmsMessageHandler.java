package com.beacon.notification.channel.handler;

import com.beacon.notification.common.message.SmsChannelMessage;
import com.beacon.notification.common.messaging.MessageHandler;
import com.beacon.notification.common.provider.SmsProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SmsMessageHandler implements MessageHandler<SmsChannelMessage> {

    private final SmsProvider smsProvider;
    private final ChannelDelivery channelDelivery;

    @Override
    public void process(SmsChannelMessage message) {
        channelDelivery.deliver(message, smsProvider.isConfigured(), smsProvider.getProviderName(), smsProvider::send);
    }
}
