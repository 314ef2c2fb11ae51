package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.BulkJobStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

public record BulkJobProgress(
    UUID jobId,
    String name,
    BulkJobStatus status,
    int totalCount,
    int processedCount,
    int successCount,
    int failedCount,
    double progressPercentage,
    LocalDateTime startedAt,
    LocalDateTime completedAt,
    List<String> errorMessages
) {

    public static double percentage(int processed, int total) {
        if (total <= 0) {
            return 0.0;
        }
        return Math.round(processed * 10000.0 / total) / 100.0;
    }

    /**
     * Percentage with two decimals, e.g. {@code 66.67%}.
     */
    public String progressText() {
        return String.format(Locale.ROOT, "%.2f%%", progressPercentage);
    }
}
