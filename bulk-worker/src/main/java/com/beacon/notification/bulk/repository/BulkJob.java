package com.beacon.notification.bulk.repository;

import com.beacon.notification.common.model.BulkJobStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record BulkJob(
    UUID id,
    String name,
    BulkJobStatus status,
    int totalCount,
    int processedCount,
    int successCount,
    int failedCount,
    LocalDateTime startedAt,
    LocalDateTime completedAt,
    String lockedBy,
    LocalDateTime leaseUntil
) {
}
