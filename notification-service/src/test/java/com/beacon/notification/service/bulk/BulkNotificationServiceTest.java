package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.BulkJobNotFoundException;
import com.beacon.notification.common.model.BulkJobStatus;
import com.beacon.notification.common.model.NotificationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BulkNotificationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private BulkNotificationJobRepository jobRepository;

    @Mock
    private BulkNotificationItemRepository itemRepository;

    @Mock
    private BulkJobRunPublisher runPublisher;

    private BulkNotificationService service;

    @BeforeEach
    void setUp() {
        service = new BulkNotificationService(jobRepository, itemRepository, new BulkJobStatusTransitions(),
            runPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CreateBulkJobCommand command(LocalDateTime scheduledFor) {
        return new CreateBulkJobCommand("Spring campaign", "March promo", "ops", scheduledFor, List.of(
            new CreateBulkJobCommand.Item("a@example.com", "email", Map.of("subject", "Hi")),
            new CreateBulkJobCommand.Item("+15550001", "Sms", null),
            new CreateBulkJobCommand.Item("device-token", "push", Map.of())));
    }

    private static BulkNotificationJob job(BulkJobStatus status) {
        BulkNotificationJob job = new BulkNotificationJob();
        job.setId(UUID.randomUUID());
        job.setName("job");
        job.setStatus(status);
        return job;
    }

    @Test
    void testCreateJob_Immediate_PersistsPendingJobAndPublishes() {
        UUID jobId = service.createJob(command(null));

        ArgumentCaptor<BulkNotificationJob> saved = ArgumentCaptor.forClass(BulkNotificationJob.class);
        verify(jobRepository).save(saved.capture());
        BulkNotificationJob job = saved.getValue();
        assertEquals(jobId, job.getId());
        assertEquals(BulkJobStatus.PENDING, job.getStatus());
        assertEquals(3, job.getTotalCount());
        assertEquals(0, job.getProcessedCount());
        assertEquals(List.of("EMAIL", "SMS", "PUSH"),
            job.getItems().stream().map(BulkNotificationItem::getChannel).toList());
        assertEquals(List.of(0, 1, 2), job.getItems().stream().map(BulkNotificationItem::getPosition).toList());
        assertTrue(job.getItems().stream().allMatch(item -> item.getStatus() == NotificationStatus.PENDING));
        assertEquals("Hi", job.getItems().get(0).getVariables().get("subject"));
        verify(runPublisher).publishAfterCommit(jobId);
    }

    @Test
    void testCreateJob_FutureSchedule_HoldsJobWithoutPublishing() {
        LocalDateTime later = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(2);

        service.createJob(command(later));

        ArgumentCaptor<BulkNotificationJob> saved = ArgumentCaptor.forClass(BulkNotificationJob.class);
        verify(jobRepository).save(saved.capture());
        assertEquals(BulkJobStatus.SCHEDULED, saved.getValue().getStatus());
        assertEquals(later, saved.getValue().getScheduledFor());
        verifyNoInteractions(runPublisher);
    }

    @Test
    void testCreateJob_WithoutItems_Throws() {
        CreateBulkJobCommand empty = new CreateBulkJobCommand("name", null, null, null, List.of());

        assertThrows(InvalidBulkJobException.class, () -> service.createJob(empty));
        verify(jobRepository, never()).save(any());
    }

    @Test
    void testCancelJob_WhenRunning_UsesConditionalUpdateOnly() {
        BulkNotificationJob job = job(BulkJobStatus.PROCESSING);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepository.cancel(job.getId(), LocalDateTime.ofInstant(NOW, ZoneOffset.UTC))).thenReturn(1);

        service.cancelJob(job.getId());

        verify(jobRepository).cancel(job.getId(), LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(jobRepository, never()).save(any());
        // the loaded snapshot is never written back
        assertEquals(BulkJobStatus.PROCESSING, job.getStatus());
    }

    @Test
    void testCancelJob_WhenWorkerFinishesFirst_ThrowsStateException() {
        BulkNotificationJob job = job(BulkJobStatus.PROCESSING);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepository.cancel(eq(job.getId()), any())).thenReturn(0);

        assertThrows(BulkJobStateException.class, () -> service.cancelJob(job.getId()));
    }

    @Test
    void testCancelJob_WhenTerminal_Throws() {
        BulkNotificationJob job = job(BulkJobStatus.COMPLETED);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        assertThrows(BulkJobStateException.class, () -> service.cancelJob(job.getId()));
        verify(jobRepository, never()).cancel(any(), any());
    }

    @Test
    void testCancelJob_WhenMissing_ThrowsNotFound() {
        UUID jobId = UUID.randomUUID();
        when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

        assertThrows(BulkJobNotFoundException.class, () -> service.cancelJob(jobId));
    }

    @Test
    void testGetProgress_ComputesPercentage() {
        BulkNotificationJob job = job(BulkJobStatus.PROCESSING);
        job.setTotalCount(3);
        job.setProcessedCount(2);
        job.setSuccessCount(1);
        job.setFailedCount(1);
        job.getErrorMessages().add("2026-03-01 12:00:00: Item x: boom");
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        BulkJobProgress progress = service.getProgress(job.getId());

        assertEquals(66.67, progress.progressPercentage());
        assertEquals("66.67%", progress.progressText());
        assertEquals(1, progress.errorMessages().size());
    }

    @Test
    void testResubmitJob_WhenCompleted_Throws() {
        BulkNotificationJob job = job(BulkJobStatus.COMPLETED);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

        assertThrows(BulkJobStateException.class, () -> service.resubmitJob(job.getId()));
        verifyNoInteractions(runPublisher);
    }

    @Test
    void testResubmitJob_WhenDraft_MovesToPendingAndPublishes() {
        BulkNotificationJob job = job(BulkJobStatus.DRAFT);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepository.transition(eq(job.getId()), eq(BulkJobStatus.DRAFT), eq(BulkJobStatus.PENDING), any()))
            .thenReturn(1);

        service.resubmitJob(job.getId());

        verify(runPublisher).publishAfterCommit(job.getId());
    }

    @Test
    void testResubmitJob_WhenWorkerClaimedItMeanwhile_DoesNotPublish() {
        BulkNotificationJob job = job(BulkJobStatus.PENDING);
        when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepository.transition(eq(job.getId()), eq(BulkJobStatus.PENDING), eq(BulkJobStatus.PENDING), any()))
            .thenReturn(0);

        assertThrows(BulkJobStateException.class, () -> service.resubmitJob(job.getId()));
        verifyNoInteractions(runPublisher);
    }

    @Test
    void testGetItems_FiltersByStatus() {
        UUID jobId = UUID.randomUUID();
        BulkNotificationItem failed = new BulkNotificationItem();
        failed.setId(UUID.randomUUID());
        failed.setRecipient("a@example.com");
        failed.setChannel("EMAIL");
        failed.setStatus(NotificationStatus.FAILED);
        failed.setErrorMessage("bounced");
        when(jobRepository.existsById(jobId)).thenReturn(true);
        when(itemRepository.findByJobIdAndStatusOrderByPositionAsc(jobId, NotificationStatus.FAILED))
            .thenReturn(List.of(failed));

        List<BulkItemView> items = service.getItems(jobId, NotificationStatus.FAILED);

        assertEquals(1, items.size());
        assertEquals("bounced", items.get(0).errorMessage());
    }

    @Test
    void testPercentage_WhenNoItems_IsZero() {
        assertEquals(0.0, BulkJobProgress.percentage(0, 0));
        assertEquals(100.0, BulkJobProgress.percentage(3, 3));
    }
}
