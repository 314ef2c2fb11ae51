package com.beacon.notification.common.message;

import com.beacon.notification.common.model.ChannelType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Push dispatch to a device token ({@code to}) or a topic {@code condition}.
 * {@code data} is delivered to the app untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PushChannelMessage(
    UUID channelId,
    UUID notificationId,
    String to,
    PushContent content,
    Map<String, String> data,
    String platform,
    String priority,
    Integer timeToLive,
    String condition,
    Boolean mutableContent,
    Boolean contentAvailable
) implements ChannelMessage {

    public PushChannelMessage {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @Override
    @JsonIgnore
    public ChannelType channelType() {
        return ChannelType.PUSH;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PushContent(String title, String body, String clickAction) {
    }
}
