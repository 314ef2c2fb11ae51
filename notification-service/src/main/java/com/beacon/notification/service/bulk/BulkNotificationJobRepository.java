package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.BulkJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BulkNotificationJobRepository extends JpaRepository<BulkNotificationJob, UUID> {

    @Query("SELECT j.id FROM BulkNotificationJob j WHERE j.status = :status AND j.scheduledFor <= :now ORDER BY j.scheduledFor")
    List<UUID> findDueJobIds(@Param("status") BulkJobStatus status, @Param("now") LocalDateTime now, Pageable pageable);

    /**
     * Atomically move a job between statuses. Returns 0 when another instance got there first
     * or the job is no longer in {@code expected}.
     */
    @Modifying
    @Query("UPDATE BulkNotificationJob j SET j.status = :target, j.updatedAt = :now WHERE j.id = :id AND j.status = :expected")
    int transition(@Param("id") UUID id,
                   @Param("expected") BulkJobStatus expected,
                   @Param("target") BulkJobStatus target,
                   @Param("now") LocalDateTime now);

    /**
     * Atomically move a job to {@code target} unless its current status is one of {@code excluded}.
     * Only status and {@code updatedAt} are written, so counters maintained by the worker are untouched.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BulkNotificationJob j SET j.status = :target, j.updatedAt = :now WHERE j.id = :id AND j.status NOT IN :excluded")
    int transitionUnlessIn(@Param("id") UUID id,
                           @Param("excluded") Collection<BulkJobStatus> excluded,
                           @Param("target") BulkJobStatus target,
                           @Param("now") LocalDateTime now);

    default int cancel(UUID id, LocalDateTime now) {
        return transitionUnlessIn(id, BulkJobStatus.terminalStatuses(), BulkJobStatus.CANCELLED, now);
    }

    @Query("""
        SELECT j.id FROM BulkNotificationJob j
        WHERE j.status = :status AND (j.leaseUntil IS NULL OR j.leaseUntil < :now)
        ORDER BY j.updatedAt
        """)
    List<UUID> findStalledJobIds(@Param("status") BulkJobStatus status, @Param("now") LocalDateTime now, Pageable pageable);

    /**
     * Drops an expired worker lease so the next run message can claim the job, and holds the
     * job back from further recovery until {@code recheckAfter}. Returns 0 when the job was
     * renewed, finished or already released by another instance.
     */
    @Modifying
    @Query(value = """
        UPDATE bulk_notification_jobs
        SET locked_by = NULL, lease_until = :recheckAfter, updated_at = :now
        WHERE id = :id AND status = 'PROCESSING' AND (lease_until IS NULL OR lease_until < :now)
        """, nativeQuery = true)
    int releaseExpiredLease(@Param("id") UUID id,
                            @Param("now") LocalDateTime now,
                            @Param("recheckAfter") LocalDateTime recheckAfter);
}
