package com.beacon.notification.channel.handler;

import com.beacon.notification.common.message.EmailChannelMessage;
import com.beacon.notification.common.messaging.MessageHandler;
import com.beacon.notification.common.provider.EmailProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailMessageHandler implements MessageHandler<EmailChannelMessage> {

    private final EmailProvider emailProvider;
    private final ChannelDelivery channelDelivery;

    @Override
    public void process(EmailChannelMessage message) {
        channelDelivery.deliver(message, emailProvider.isConfigured(), emailProvider.getProviderName(), emailProvider::send);
    }
}
