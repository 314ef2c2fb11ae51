package com.beacon.notification.bulk.repository;

import com.beacon.notification.common.model.NotificationStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One recipient of a bulk job. {@code channel} is the raw stored value and is only
 * validated when the item is dispatched.
 */
public record BulkItem(
    UUID id,
    UUID jobId,
    int position,
    String recipient,
    String channel,
    Map<String, String> variables,
    NotificationStatus status
) {

    public BulkItem {
        variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
    }

    public String variable(String name, String defaultValue) {
        String value = variables.get(name);
        return value != null && !value.isBlank() ? value : defaultValue;
    }
}
