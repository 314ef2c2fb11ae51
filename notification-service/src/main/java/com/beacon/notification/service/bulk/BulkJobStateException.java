package com.beacon.notification.service.bulk;

/**
 * The requested change is not allowed in the job's current status.
 */
public class BulkJobStateException extends RuntimeException {

    public BulkJobStateException(String message) {
        super(message);
    }
}
