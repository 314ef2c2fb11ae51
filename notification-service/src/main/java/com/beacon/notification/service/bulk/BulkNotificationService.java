package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.BulkJobNotFoundException;
import com.beacon.notification.common.model.BulkJobStatus;
import com.beacon.notification.common.model.NotificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Bulk job lifecycle: create, cancel, resubmit and read progress.
 * 
 * Running a job is the bulk worker's responsibility; this service only hands it a
 * "run job" message. Immediate jobs are published after the creating transaction
 * commits, scheduled jobs later by {@link ScheduledBulkJobDispatcher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BulkNotificationService {

    private static final int MAX_NAME_LENGTH = 200;

    private final BulkNotificationJobRepository jobRepository;
    private final BulkNotificationItemRepository itemRepository;
    private final BulkJobStatusTransitions transitions;
    private final BulkJobRunPublisher runPublisher;
    private final Clock clock;

    @Transactional
    public UUID createJob(CreateBulkJobCommand command) {
        validate(command);
        LocalDateTime now = LocalDateTime.now(clock);
        boolean scheduled = command.scheduledFor() != null && command.scheduledFor().isAfter(now);

        BulkNotificationJob job = new BulkNotificationJob();
        job.setId(UUID.randomUUID());
        job.setName(command.name().trim());
        job.setDescription(command.description());
        job.setCreatedBy(command.createdBy());
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        job.setScheduledFor(scheduled ? command.scheduledFor() : null);
        job.setStatus(scheduled ? BulkJobStatus.SCHEDULED : BulkJobStatus.PENDING);

        for (CreateBulkJobCommand.Item request : command.items()) {
            BulkNotificationItem item = new BulkNotificationItem();
            item.setId(UUID.randomUUID());
            item.setRecipient(request.recipient().trim());
            item.setChannel(request.channel().trim().toUpperCase(Locale.ROOT));
            if (request.variables() != null) {
                item.setVariables(new LinkedHashMap<>(request.variables()));
            }
            item.setStatus(NotificationStatus.PENDING);
            item.setCreatedAt(now);
            item.setUpdatedAt(now);
            job.addItem(item);
        }
        job.setTotalCount(job.getItems().size());

        jobRepository.save(job);
        log.info("Bulk notification job {} created with {} items ({})", job.getId(), job.getTotalCount(), job.getStatus());

        if (!scheduled) {
            runPublisher.publishAfterCommit(job.getId());
        }
        return job.getId();
    }

    /**
     * @throws BulkJobNotFoundException when the job does not exist
     * @throws BulkJobStateException when the job already completed, failed or was cancelled
     */
    @Transactional
    public void cancelJob(UUID jobId) {
        BulkNotificationJob job = findJob(jobId);
        if (job.getStatus().isTerminal()) {
            throw new BulkJobStateException("Cannot cancel a job that has already completed, failed, or was cancelled");
        }
        transitions.validate(job.getStatus(), BulkJobStatus.CANCELLED);
        // the worker may finish the job between the read above and this update
        if (jobRepository.cancel(jobId, LocalDateTime.now(clock)) == 0) {
            throw new BulkJobStateException("Job " + jobId + " finished before it could be cancelled");
        }
        log.info("Bulk notification job {} cancelled", jobId);
    }

    /**
     * Publishes the run message again for a job whose earlier message was lost.
     * Only DRAFT and PENDING jobs qualify; DRAFT jobs move to PENDING.
     */
    @Transactional
    public void resubmitJob(UUID jobId) {
        BulkNotificationJob job = findJob(jobId);
        BulkJobStatus status = job.getStatus();
        if (status != BulkJobStatus.PENDING && status != BulkJobStatus.DRAFT) {
            throw new BulkJobStateException("Only draft or pending jobs can be resubmitted, job is " + status);
        }
        transitions.validate(status, BulkJobStatus.PENDING);
        if (jobRepository.transition(jobId, status, BulkJobStatus.PENDING, LocalDateTime.now(clock)) == 0) {
            throw new BulkJobStateException("Job " + jobId + " changed status while being resubmitted");
        }
        runPublisher.publishAfterCommit(jobId);
        log.info("Bulk notification job {} resubmitted", jobId);
    }

    @Transactional(readOnly = true)
    public BulkJobProgress getProgress(UUID jobId) {
        return toProgress(findJob(jobId));
    }

    @Transactional(readOnly = true)
    public Page<BulkJobProgress> listJobs(Pageable pageable) {
        return jobRepository.findAll(pageable).map(this::toProgress);
    }

    /**
     * @param status optional filter; null returns every item
     */
    @Transactional(readOnly = true)
    public List<BulkItemView> getItems(UUID jobId, NotificationStatus status) {
        if (!jobRepository.existsById(jobId)) {
            throw new BulkJobNotFoundException(jobId);
        }
        List<BulkNotificationItem> items = status == null
            ? itemRepository.findByJobIdOrderByPositionAsc(jobId)
            : itemRepository.findByJobIdAndStatusOrderByPositionAsc(jobId, status);
        return items.stream().map(BulkItemView::from).toList();
    }

    private BulkNotificationJob findJob(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new BulkJobNotFoundException(jobId));
    }

    private BulkJobProgress toProgress(BulkNotificationJob job) {
        return new BulkJobProgress(
            job.getId(),
            job.getName(),
            job.getStatus(),
            job.getTotalCount(),
            job.getProcessedCount(),
            job.getSuccessCount(),
            job.getFailedCount(),
            BulkJobProgress.percentage(job.getProcessedCount(), job.getTotalCount()),
            job.getStartedAt(),
            job.getCompletedAt(),
            List.copyOf(job.getErrorMessages()));
    }

    private void validate(CreateBulkJobCommand command) {
        if (command.name() == null || command.name().isBlank()) {
            throw new InvalidBulkJobException("Job name is required");
        }
        if (command.name().trim().length() > MAX_NAME_LENGTH) {
            throw new InvalidBulkJobException("Job name must not exceed " + MAX_NAME_LENGTH + " characters");
        }
        if (command.items() == null || command.items().isEmpty()) {
            throw new InvalidBulkJobException("At least one item is required");
        }
        for (CreateBulkJobCommand.Item item : command.items()) {
            if (item.recipient() == null || item.recipient().isBlank()) {
                throw new InvalidBulkJobException("Every item needs a recipient");
            }
            if (item.channel() == null || item.channel().isBlank()) {
                throw new InvalidBulkJobException("Every item needs a channel");
            }
        }
    }
}
