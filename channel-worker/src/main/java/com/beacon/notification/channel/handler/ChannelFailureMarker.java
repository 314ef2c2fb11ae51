package com.beacon.notification.channel.handler;

import com.beacon.notification.common.message.ChannelMessage;
import com.beacon.notification.common.model.NotificationStatus;
import com.beacon.notification.common.status.ChannelStatusUpdater;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Marks a channel row FAILED when its message is dead-lettered.
 * Correlates by the notification and channel ids carried in the message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChannelFailureMarker {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final ChannelStatusUpdater statusUpdater;

    public void markFailed(ChannelMessage message, Throwable cause) {
        String error = cause != null && cause.getMessage() != null ? cause.getMessage() : "Delivery failed";
        if (error.length() > MAX_ERROR_LENGTH) {
            error = error.substring(0, MAX_ERROR_LENGTH);
        }
        statusUpdater.updateChannelStatus(message.channelType(), message.notificationId(), message.channelId(),
            NotificationStatus.FAILED, error);
        log.info("Marked {} channel {} of notification {} as FAILED",
            message.channelType(), message.channelId(), message.notificationId());
    }
}
