package com.beacon.notification.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a bulk notification job.
 * 
 * COMPLETED, FAILED and CANCELLED are terminal: once a job reaches one of them
 * the processing pipeline never changes it again.
 */
public enum BulkJobStatus {
    DRAFT,
    SCHEDULED,
    PENDING,
    PROCESSING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Set<BulkJobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static Set<BulkJobStatus> terminalStatuses() {
        return EnumSet.copyOf(TERMINAL);
    }
}
