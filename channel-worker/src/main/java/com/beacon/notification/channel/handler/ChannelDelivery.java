package com.beacon.notification.channel.handler;

import com.beacon.notification.common.message.ChannelMessage;
import com.beacon.notification.common.model.NotificationStatus;
import com.beacon.notification.common.provider.DeliveryResult;
import com.beacon.notification.common.status.ChannelStatusUpdater;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Send path shared by the channel handlers.
 * 
 * - provider not configured: logged and skipped, the channel row stays PENDING
 * - provider reports failure: rethrown as a transient or permanent delivery exception
 *   according to its error category, leaving retry decisions to the queue consumer
 * - success: channel row marked SENT
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChannelDelivery {

    private final ChannelStatusUpdater statusUpdater;

    public <T extends ChannelMessage> void deliver(T message, boolean providerConfigured, String providerName,
                                                   Function<T, DeliveryResult> send) {
        if (!providerConfigured) {
            log.warn("No active {} provider configured, skipping notification {} channel {}",
                message.channelType(), message.notificationId(), message.channelId());
            return;
        }

        log.info("Processing {} notification {} for recipient {} via {}",
            message.channelType(), message.notificationId(), message.to(), providerName);
        DeliveryResult result = send.apply(message);
        if (result == null || !result.success()) {
            throw result == null
                ? new IllegalStateException(providerName + " returned no result")
                : result.toException();
        }

        statusUpdater.updateChannelStatus(message.channelType(), message.notificationId(), message.channelId(),
            NotificationStatus.SENT, null);
        log.info("{} notification {} sent via {} (provider id {})",
            message.channelType(), message.notificationId(), providerName, result.providerMessageId());
    }
}
