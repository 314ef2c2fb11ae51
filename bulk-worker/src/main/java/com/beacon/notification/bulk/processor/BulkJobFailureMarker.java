package com.beacon.notification.bulk.processor;

import com.beacon.notification.bulk.repository.BulkJobRepository;
import com.beacon.notification.common.message.BulkNotificationJobMessage;
import com.beacon.notification.common.model.BulkJobNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Marks a bulk job FAILED when its run message is dead-lettered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BulkJobFailureMarker {

    private final BulkJobRepository jobRepository;
    private final Clock clock;

    public void markFailed(BulkNotificationJobMessage message, Throwable cause) {
        if (cause instanceof BulkJobNotFoundException) {
            log.warn("Bulk job {} does not exist, nothing to mark", message.jobId());
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        String error = cause != null && cause.getMessage() != null ? cause.getMessage() : "Job processing failed";
        if (jobRepository.failJob(message.jobId(), now)) {
            jobRepository.appendError(message.jobId(),
                "%s: Job failed: %s".formatted(BulkJobProcessor.ERROR_TIMESTAMP.format(now), error));
            log.info("Marked bulk job {} as FAILED", message.jobId());
        } else {
            log.info("Bulk job {} already terminal, not marking FAILED", message.jobId());
        }
    }
}
