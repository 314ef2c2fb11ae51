package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.BulkJobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Restarts PROCESSING bulk jobs whose worker lease has expired.
 * 
 * A worker that dies mid-run leaves its job PROCESSING under a lease nobody renews, and
 * workers that receive the redelivered run message skip it while that lease is live.
 * Once the lease expires this sweeper clears it and publishes a fresh run message; the
 * next worker claims the job and continues with the items still PENDING.
 */
@Service
@Slf4j
public class StalledBulkJobRecovery {

    private final BulkNotificationJobRepository jobRepository;
    private final BulkJobRunPublisher runPublisher;
    private final Clock clock;
    private final int batchSize;
    private final Duration recheckAfter;

    @Lazy
    @Autowired
    private StalledBulkJobRecovery self;

    public StalledBulkJobRecovery(BulkNotificationJobRepository jobRepository,
                                  BulkJobRunPublisher runPublisher,
                                  Clock clock,
                                  @Value("${notification.bulk.recovery.batch-size:50}") int batchSize,
                                  @Value("${notification.bulk.recovery.recheck-after:PT10M}") Duration recheckAfter) {
        this.jobRepository = jobRepository;
        this.runPublisher = runPublisher;
        this.clock = clock;
        this.batchSize = batchSize;
        this.recheckAfter = recheckAfter;
    }

    @Scheduled(fixedDelayString = "${notification.bulk.recovery.poll-interval:PT2M}",
               initialDelayString = "${notification.bulk.recovery.initial-delay:PT1M}")
    public void recoverStalledJobs() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<UUID> stalled = jobRepository.findStalledJobIds(BulkJobStatus.PROCESSING, now, PageRequest.of(0, batchSize));
        if (stalled.isEmpty()) {
            log.debug("No stalled bulk jobs");
            return;
        }

        int recovered = 0;
        for (UUID jobId : stalled) {
            try {
                if (self().recoverJob(jobId)) {
                    recovered++;
                }
            } catch (Exception e) {
                log.error("Failed to recover stalled bulk job {}", jobId, e);
            }
        }
        log.warn("Recovered {} of {} bulk jobs with an expired worker lease", recovered, stalled.size());
    }

    /**
     * @return false when the lease was renewed, the job finished or another instance recovered it first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean recoverJob(UUID jobId) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (jobRepository.releaseExpiredLease(jobId, now, now.plus(recheckAfter)) == 0) {
            log.debug("Bulk job {} no longer stalled, skipping", jobId);
            return false;
        }
        runPublisher.publishAfterCommit(jobId);
        log.info("Released expired lease on bulk job {} and republished its run message", jobId);
        return true;
    }

    private StalledBulkJobRecovery self() {
        return self != null ? self : this;
    }
}
