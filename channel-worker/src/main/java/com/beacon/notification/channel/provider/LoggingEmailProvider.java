package com.beacon.notification.channel.provider;

import com.beacon.notification.common.message.EmailChannelMessage;
import com.beacon.notification.common.provider.DeliveryResult;
import com.beacon.notification.common.provider.EmailProvider;
import com.beacon.notification.common.provider.ProviderErrorCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Email provider that records the send in the log instead of calling a vendor.
 * Replace with a vendor-backed {@link EmailProvider} bean in deployments that deliver mail.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingEmailProvider implements EmailProvider {

    private final ProviderProperties properties;

    @Override
    public DeliveryResult send(EmailChannelMessage message) {
        if (message.to() == null || !message.to().contains("@")) {
            return DeliveryResult.createFailure("Invalid email address: " + message.to(), ProviderErrorCategory.PERMANENT);
        }
        log.info("Email to {} from {} subject '{}' ({} chars, html={})",
            message.to(), properties.getEmail().getDefaultSender(), message.subject(),
            message.body() != null ? message.body().length() : 0, message.bodyHtml());
        return DeliveryResult.createSuccess(UUID.randomUUID().toString());
    }

    @Override
    public String getProviderName() {
        return properties.getEmail().getName();
    }

    @Override
    public boolean isConfigured() {
        return properties.getEmail().isEnabled();
    }
}
