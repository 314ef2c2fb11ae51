package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.NotificationStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "bulk_notification_items", indexes = {
    @Index(name = "idx_bulk_items_job_id", columnList = "job_id"),
    @Index(name = "idx_bulk_items_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
public class BulkNotificationItem {

    @Id
    @Column(name = "id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false)
    private BulkNotificationJob job;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "recipient", nullable = false, length = 500)
    private String recipient;

    /**
     * Stored as entered. Unknown channels are rejected per item when the job runs,
     * so one bad row does not block the batch.
     */
    @Column(name = "channel", nullable = false, length = 20)
    private String channel;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "bulk_notification_item_variables", joinColumns = @JoinColumn(name = "item_id"))
    @MapKeyColumn(name = "name", length = 100)
    @Column(name = "value", columnDefinition = "TEXT")
    private Map<String, String> variables = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private NotificationStatus status;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "notification_id")
    private UUID notificationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
