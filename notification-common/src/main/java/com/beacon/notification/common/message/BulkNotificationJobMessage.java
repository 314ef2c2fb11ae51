package com.beacon.notification.common.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.UUID;

/**
 * "Run this job" message published to the bulk queue. The worker loads the job and its items by id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkNotificationJobMessage(UUID jobId) {
}
