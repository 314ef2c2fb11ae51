package com.beacon.notification.bulk.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Job and item state used by the bulk processor.
 * 
 * Every mutation is a single conditional statement, so counters never go through a
 * read-modify-write and a redelivered run cannot count an item twice.
 */
public interface BulkJobRepository {

    Optional<BulkJob> findJob(UUID jobId);

    /**
     * Claims the job for {@code workerId} and moves it to PROCESSING, keeping an existing
     * {@code startedAt}. Succeeds when the job is not terminal and is unlocked, its lease
     * has expired, or the lease already belongs to {@code workerId}.
     */
    boolean claimLease(UUID jobId, String workerId, LocalDateTime now, LocalDateTime leaseUntil);

    /**
     * Extends the lease. Fails when the job is no longer PROCESSING under {@code workerId}.
     */
    boolean renewLease(UUID jobId, String workerId, LocalDateTime now, LocalDateTime leaseUntil);

    /**
     * Items in creation order, with their variables.
     */
    List<BulkItem> findItems(UUID jobId);

    /**
     * @return false when the item was no longer PENDING
     */
    boolean markItemSent(UUID itemId, UUID notificationId, LocalDateTime now);

    /**
     * @return false when the item was no longer PENDING
     */
    boolean markItemFailed(UUID itemId, String errorMessage, LocalDateTime now);

    void incrementSuccess(UUID jobId, LocalDateTime now);

    void incrementFailure(UUID jobId, LocalDateTime now);

    void appendError(UUID jobId, String error);

    boolean completeJob(UUID jobId, String workerId, LocalDateTime now);

    /**
     * Moves a non-terminal job to FAILED and releases its lease.
     *
     * @return false when the job was missing or already terminal
     */
    boolean failJob(UUID jobId, LocalDateTime now);
}
