package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.BulkJobStatus;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed job status changes made through this service.
 * 
 * - DRAFT -> SCHEDULED, PENDING, CANCELLED
 * - SCHEDULED -> PENDING, CANCELLED
 * - PENDING -> PROCESSING, CANCELLED
 * - PROCESSING -> PAUSED, COMPLETED, FAILED, CANCELLED
 * - PAUSED -> PROCESSING, CANCELLED
 * - COMPLETED, FAILED, CANCELLED -> (terminal)
 * 
 * Pure enum-map lookup, no database or clock access.
 */
@Component
public class BulkJobStatusTransitions {

    private static final Map<BulkJobStatus, Set<BulkJobStatus>> VALID_TRANSITIONS = new EnumMap<>(BulkJobStatus.class);

    static {
        VALID_TRANSITIONS.put(BulkJobStatus.DRAFT,
            EnumSet.of(BulkJobStatus.SCHEDULED, BulkJobStatus.PENDING, BulkJobStatus.CANCELLED));
        VALID_TRANSITIONS.put(BulkJobStatus.SCHEDULED,
            EnumSet.of(BulkJobStatus.PENDING, BulkJobStatus.CANCELLED));
        VALID_TRANSITIONS.put(BulkJobStatus.PENDING,
            EnumSet.of(BulkJobStatus.PROCESSING, BulkJobStatus.CANCELLED));
        VALID_TRANSITIONS.put(BulkJobStatus.PROCESSING,
            EnumSet.of(BulkJobStatus.PAUSED, BulkJobStatus.COMPLETED, BulkJobStatus.FAILED, BulkJobStatus.CANCELLED));
        VALID_TRANSITIONS.put(BulkJobStatus.PAUSED,
            EnumSet.of(BulkJobStatus.PROCESSING, BulkJobStatus.CANCELLED));
    }

    public boolean isValidTransition(BulkJobStatus from, BulkJobStatus to) {
        if (from == to) {
            return true;
        }
        if (from.isTerminal()) {
            return false;
        }
        return VALID_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public void validate(BulkJobStatus from, BulkJobStatus to) {
        if (!isValidTransition(from, to)) {
            throw new BulkJobStateException("Cannot change bulk job status from " + from + " to " + to);
        }
    }
}
