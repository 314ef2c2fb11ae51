package com.beacon.notification.common.model;

/**
 * Status of a per-recipient dispatch: a channel row or a bulk item.
 */
public enum NotificationStatus {
    PENDING,
    SENT,
    FAILED,
    SCHEDULED,
    CANCELLED,
    RECURRING
}
