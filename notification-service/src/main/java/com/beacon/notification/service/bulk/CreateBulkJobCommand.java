package com.beacon.notification.service.bulk;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Input for creating a bulk job.
 *
 * @param scheduledFor when set and in the future, the job is held as SCHEDULED until then
 */
public record CreateBulkJobCommand(
    String name,
    String description,
    String createdBy,
    LocalDateTime scheduledFor,
    List<Item> items
) {

    public record Item(String recipient, String channel, Map<String, String> variables) {
    }
}
