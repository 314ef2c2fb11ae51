package com.beacon.notification.common.message;

import com.beacon.notification.common.model.ChannelType;

import java.util.UUID;

/**
 * Message published to a channel queue for one recipient.
 * The ids correlate the message with its notification and channel rows.
 */
public interface ChannelMessage {

    UUID channelId();

    UUID notificationId();

    String to();

    ChannelType channelType();
}
