package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.BulkJobStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A batch of recipient-level notifications processed as one unit.
 * 
 * Counters and run timestamps are written by the bulk worker while the job runs and
 * are never flushed from this entity after insert. Status changes go through the
 * conditional updates of {@link BulkNotificationJobRepository}. {@code lockedBy}/{@code leaseUntil}
 * hold the worker lease and are read-only here.
 */
@Entity
@Table(name = "bulk_notification_jobs", indexes = {
    @Index(name = "idx_bulk_jobs_status", columnList = "status"),
    @Index(name = "idx_bulk_jobs_scheduled_for", columnList = "scheduled_for")
})
@Getter
@Setter
@NoArgsConstructor
public class BulkNotificationJob {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BulkJobStatus status;

    @Column(name = "total_count", nullable = false)
    private int totalCount;

    @Column(name = "processed_count", nullable = false, updatable = false)
    private int processedCount;

    @Column(name = "success_count", nullable = false, updatable = false)
    private int successCount;

    @Column(name = "failed_count", nullable = false, updatable = false)
    private int failedCount;

    @Column(name = "scheduled_for")
    private LocalDateTime scheduledFor;

    @Column(name = "started_at", updatable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at", updatable = false)
    private LocalDateTime completedAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "locked_by", length = 100, insertable = false, updatable = false)
    private String lockedBy;

    @Column(name = "lease_until", insertable = false, updatable = false)
    private LocalDateTime leaseUntil;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "bulk_notification_job_errors", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "message", columnDefinition = "TEXT", nullable = false)
    private List<String> errorMessages = new ArrayList<>();

    @OneToMany(mappedBy = "job", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<BulkNotificationItem> items = new ArrayList<>();

    public void addItem(BulkNotificationItem item) {
        item.setJob(this);
        item.setPosition(items.size());
        items.add(item);
    }
}
