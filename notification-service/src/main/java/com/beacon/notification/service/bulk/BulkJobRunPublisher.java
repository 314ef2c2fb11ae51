package com.beacon.notification.service.bulk;

import com.beacon.notification.common.message.BulkNotificationJobMessage;
import com.beacon.notification.common.messaging.MessagePublisher;
import com.beacon.notification.common.messaging.QueueNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

/**
 * Publishes "run job" messages to the bulk queue once the surrounding transaction has committed,
 * so a worker never sees a job id before the job row is visible.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BulkJobRunPublisher {

    private final MessagePublisher messagePublisher;

    public void publishAfterCommit(UUID jobId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish(jobId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publish(jobId);
            }
        });
    }

    private void publish(UUID jobId) {
        try {
            messagePublisher.publish(QueueNames.BULK, new BulkNotificationJobMessage(jobId));
            log.info("Published run message for bulk job {}", jobId);
        } catch (RuntimeException e) {
            // job stays PENDING; an operator can re-trigger it
            log.error("Failed to publish run message for bulk job {}", jobId, e);
        }
    }
}
