package com.beacon.notification.common.status;

import com.beacon.notification.common.model.ChannelType;
import com.beacon.notification.common.model.NotificationStatus;

import java.util.UUID;

/**
 * Updates the status of one per-recipient channel row.
 * Called from failure-handling paths, where callers wrap it and swallow its errors.
 */
public interface ChannelStatusUpdater {

    /**
     * @return true when a row was updated
     */
    boolean updateChannelStatus(ChannelType channelType, UUID notificationId, UUID channelId,
                                NotificationStatus status, String errorMessage);
}
