package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.NotificationStatus;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record BulkItemView(
    UUID id,
    String recipient,
    String channel,
    Map<String, String> variables,
    NotificationStatus status,
    String errorMessage,
    LocalDateTime sentAt,
    UUID notificationId
) {

    static BulkItemView from(BulkNotificationItem item) {
        return new BulkItemView(
            item.getId(),
            item.getRecipient(),
            item.getChannel(),
            Map.copyOf(item.getVariables()),
            item.getStatus(),
            item.getErrorMessage(),
            item.getSentAt(),
            item.getNotificationId());
    }
}
