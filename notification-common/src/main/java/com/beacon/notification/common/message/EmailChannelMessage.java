package com.beacon.notification.common.message;

import com.beacon.notification.common.model.ChannelType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmailChannelMessage(
    UUID channelId,
    UUID notificationId,
    String to,
    String subject,
    String body,
    boolean bodyHtml
) implements ChannelMessage {

    @Override
    @JsonIgnore
    public ChannelType channelType() {
        return ChannelType.EMAIL;
    }
}
