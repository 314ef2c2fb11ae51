package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.NotificationStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BulkNotificationItemRepository extends JpaRepository<BulkNotificationItem, UUID> {

    List<BulkNotificationItem> findByJobIdOrderByPositionAsc(UUID jobId);

    List<BulkNotificationItem> findByJobIdAndStatusOrderByPositionAsc(UUID jobId, NotificationStatus status);
}
