package com.beacon.notification.channel.provider;

import com.beacon.notification.common.message.SmsChannelMessage;
import com.beacon.notification.common.provider.DeliveryResult;
import com.beacon.notification.common.provider.ProviderErrorCategory;
import com.beacon.notification.common.provider.SmsProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingSmsProvider implements SmsProvider {

    // E.164
    private static final Pattern PHONE_NUMBER = Pattern.compile("^\\+?[1-9]\\d{1,14}$");

    private final ProviderProperties properties;

    @Override
    public DeliveryResult send(SmsChannelMessage message) {
        if (message.to() == null || !PHONE_NUMBER.matcher(message.to()).matches()) {
            return DeliveryResult.createFailure("Invalid phone number: " + message.to(), ProviderErrorCategory.PERMANENT);
        }
        String sender = message.senderId() != null ? message.senderId() : properties.getSms().getDefaultSender();
        log.info("SMS to {} from {} ({} chars)", message.to(), sender,
            message.message() != null ? message.message().length() : 0);
        return DeliveryResult.createSuccess(UUID.randomUUID().toString());
    }

    @Override
    public String getProviderName() {
        return properties.getSms().getName();
    }

    @Override
    public boolean isConfigured() {
        return properties.getSms().isEnabled();
    }
}
