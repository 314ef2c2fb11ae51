package com.beacon.notification.bulk.processor;

import com.beacon.notification.bulk.config.BulkWorkerProperties;
import com.beacon.notification.bulk.repository.BulkItem;
import com.beacon.notification.bulk.repository.BulkJob;
import com.beacon.notification.bulk.repository.BulkJobRepository;
import com.beacon.notification.common.message.BulkNotificationJobMessage;
import com.beacon.notification.common.messaging.MessageHandler;
import com.beacon.notification.common.model.BulkJobNotFoundException;
import com.beacon.notification.common.model.NotificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Runs a bulk job: claims it, dispatches every pending item and completes it.
 * 
 * Item failures are recorded on the item and the job and never stop the batch.
 * Only failures to load or claim the job propagate, leaving retry and dead-lettering
 * to the queue consumer. A redelivered run skips items that are no longer PENDING,
 * so counters stay exact.
 * 
 * A job leased by another worker is skipped. If that worker died, the lease expires
 * and the job is restarted by a fresh run message from the service.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BulkJobProcessor implements MessageHandler<BulkNotificationJobMessage> {

    static final DateTimeFormatter ERROR_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final BulkJobRepository jobRepository;
    private final BulkItemDispatcher itemDispatcher;
    private final BulkWorkerProperties properties;
    private final Clock clock;

    @Override
    public void process(BulkNotificationJobMessage message) {
        UUID jobId = message.jobId();
        BulkJob job = jobRepository.findJob(jobId).orElseThrow(() -> new BulkJobNotFoundException(jobId));

        if (job.status().isTerminal()) {
            log.info("Bulk job {} is {}, skipping", jobId, job.status());
            return;
        }

        String workerId = properties.getWorkerId();
        LocalDateTime now = LocalDateTime.now(clock);
        if (!jobRepository.claimLease(jobId, workerId, now, now.plus(properties.getLeaseDuration()))) {
            // a live lease means another run owns the job; once it expires the service's
            // stalled-job recovery clears it and publishes a new run message
            log.info("Bulk job {} is leased by another worker until {}, skipping this run message", jobId, job.leaseUntil());
            return;
        }
        log.info("Processing bulk job {} ({}) with {} items", jobId, job.name(), job.totalCount());

        List<BulkItem> items = jobRepository.findItems(jobId);
        int processed = 0;
        int interval = Math.max(1, properties.getProgressInterval());

        for (BulkItem item : items) {
            if (item.status() != NotificationStatus.PENDING) {
                continue;
            }
            processItem(jobId, item);
            processed++;

            if (processed % interval == 0 && !checkpoint(jobId, workerId, job, processed)) {
                return;
            }
        }

        if (jobRepository.completeJob(jobId, workerId, LocalDateTime.now(clock))) {
            log.info("Bulk job {} completed, {} items processed in this run", jobId, processed);
        } else {
            log.warn("Bulk job {} was not completed: lease lost or status changed during the run", jobId);
        }
    }

    private void processItem(UUID jobId, BulkItem item) {
        try {
            UUID notificationId = itemDispatcher.dispatch(jobId, item);
            if (jobRepository.markItemSent(item.id(), notificationId, LocalDateTime.now(clock))) {
                jobRepository.incrementSuccess(jobId, LocalDateTime.now(clock));
            }
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Bulk job {} item {} ({}) failed: {}", jobId, item.id(), item.recipient(), error);
            LocalDateTime now = LocalDateTime.now(clock);
            if (jobRepository.markItemFailed(item.id(), error, now)) {
                jobRepository.incrementFailure(jobId, now);
                jobRepository.appendError(jobId,
                    "%s: Item %s: %s".formatted(ERROR_TIMESTAMP.format(now), item.recipient(), error));
            }
        }
    }

    /**
     * Logs progress and renews the lease.
     *
     * @return false when the lease could not be renewed and the run must stop
     */
    private boolean checkpoint(UUID jobId, String workerId, BulkJob job, int processedInRun) {
        int processed = Math.min(job.processedCount() + processedInRun, job.totalCount());
        double percent = job.totalCount() == 0 ? 100.0 : processed * 100.0 / job.totalCount();
        log.info("Bulk job {} progress: {}/{} ({}%)", jobId, processed, job.totalCount(),
            String.format(Locale.ROOT, "%.2f", percent));

        LocalDateTime now = LocalDateTime.now(clock);
        if (!jobRepository.renewLease(jobId, workerId, now, now.plus(properties.getLeaseDuration()))) {
            log.warn("Lost lease on bulk job {} after {} items, stopping this run", jobId, processedInRun);
            return false;
        }
        return true;
    }
}
