package com.beacon.notification.common.message;

import com.beacon.notification.common.model.ChannelType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

/**
 * SMS dispatch. {@code senderId} is optional; providers fall back to their default sender.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SmsChannelMessage(
    UUID channelId,
    UUID notificationId,
    String to,
    String message,
    String senderId
) implements ChannelMessage {

    @Override
    @JsonIgnore
    public ChannelType channelType() {
        return ChannelType.SMS;
    }
}
