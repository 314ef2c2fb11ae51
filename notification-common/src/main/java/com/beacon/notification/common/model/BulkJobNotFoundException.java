package com.beacon.notification.common.model;

import java.util.UUID;

/**
 * No bulk job exists for the given id. Never transient: retrying cannot make the job appear.
 */
public class BulkJobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public BulkJobNotFoundException(UUID jobId) {
        super("Bulk notification job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
