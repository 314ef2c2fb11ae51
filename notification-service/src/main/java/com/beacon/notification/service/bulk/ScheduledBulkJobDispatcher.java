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
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Releases SCHEDULED bulk jobs whose time has come.
 * 
 * Each due job is claimed with a conditional SCHEDULED -> PENDING update in its own
 * transaction, so several service instances can poll concurrently without publishing
 * a job twice. The run message goes out after the claim commits.
 */
@Service
@Slf4j
public class ScheduledBulkJobDispatcher {

    private final BulkNotificationJobRepository jobRepository;
    private final BulkJobRunPublisher runPublisher;
    private final Clock clock;
    private final int batchSize;

    /** Self-reference so the REQUIRES_NEW claim goes through the transactional proxy. */
    @Lazy
    @Autowired
    private ScheduledBulkJobDispatcher self;

    public ScheduledBulkJobDispatcher(BulkNotificationJobRepository jobRepository,
                                      BulkJobRunPublisher runPublisher,
                                      Clock clock,
                                      @Value("${notification.bulk.scheduler.batch-size:50}") int batchSize) {
        this.jobRepository = jobRepository;
        this.runPublisher = runPublisher;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${notification.bulk.scheduler.poll-interval:PT1M}")
    public void dispatchDueJobs() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<UUID> due = jobRepository.findDueJobIds(BulkJobStatus.SCHEDULED, now, PageRequest.of(0, batchSize));
        if (due.isEmpty()) {
            log.debug("No scheduled bulk jobs due");
            return;
        }

        int released = 0;
        for (UUID jobId : due) {
            try {
                if (self().releaseJob(jobId)) {
                    released++;
                }
            } catch (Exception e) {
                log.error("Failed to release scheduled bulk job {}", jobId, e);
            }
        }
        log.info("Released {} of {} due scheduled bulk jobs", released, due.size());
    }

    /**
     * @return false when the job was cancelled or claimed elsewhere in the meantime
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean releaseJob(UUID jobId) {
        int claimed = jobRepository.transition(jobId, BulkJobStatus.SCHEDULED, BulkJobStatus.PENDING, LocalDateTime.now(clock));
        if (claimed == 0) {
            log.debug("Scheduled bulk job {} already released or cancelled, skipping", jobId);
            return false;
        }
        runPublisher.publishAfterCommit(jobId);
        return true;
    }

    private ScheduledBulkJobDispatcher self() {
        return self != null ? self : this;
    }
}
