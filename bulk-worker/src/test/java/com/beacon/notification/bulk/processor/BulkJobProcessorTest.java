package com.beacon.notification.bulk.processor;

import com.beacon.notification.bulk.config.BulkWorkerProperties;
import com.beacon.notification.bulk.repository.BulkItem;
import com.beacon.notification.bulk.repository.BulkJob;
import com.beacon.notification.common.message.BulkNotificationJobMessage;
import com.beacon.notification.common.model.BulkJobNotFoundException;
import com.beacon.notification.common.model.BulkJobStatus;
import com.beacon.notification.common.model.NotificationStatus;
import com.beacon.notification.common.model.UnsupportedChannelException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BulkJobProcessorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private BulkItemDispatcher itemDispatcher;

    private InMemoryBulkJobRepository repository;
    private BulkWorkerProperties properties;
    private BulkJobProcessor processor;

    @BeforeEach
    void setUp() {
        repository = new InMemoryBulkJobRepository();
        properties = new BulkWorkerProperties();
        properties.setWorkerId("worker-a");
        properties.setLeaseDuration(Duration.ofMinutes(10));
        properties.setProgressInterval(100);
        processor = new BulkJobProcessor(repository, itemDispatcher, properties, CLOCK);
    }

    private static BulkJob job(UUID id, BulkJobStatus status, int total, String lockedBy, LocalDateTime leaseUntil) {
        return new BulkJob(id, "March newsletter", status, total, 0, 0, 0, null, null, lockedBy, leaseUntil);
    }

    private static BulkItem item(UUID jobId, int position, String recipient, String channel) {
        return new BulkItem(UUID.randomUUID(), jobId, position, recipient, channel, Map.of(), NotificationStatus.PENDING);
    }

    private void dispatchSucceedsExceptFor(String badChannel) throws Exception {
        when(itemDispatcher.dispatch(any(), any())).thenAnswer(inv -> {
            BulkItem item = inv.getArgument(1);
            if (badChannel.equals(item.channel())) {
                throw new UnsupportedChannelException(item.channel());
            }
            return UUID.randomUUID();
        });
    }

    @Test
    void testProcess_WithMixedItems_CountsSuccessAndFailureAndCompletes() throws Exception {
        UUID jobId = UUID.randomUUID();
        repository.save(job(jobId, BulkJobStatus.PENDING, 3, null, null), List.of(
            item(jobId, 0, "a@example.com", "EMAIL"),
            item(jobId, 1, "+15550001111", "FAX"),
            item(jobId, 2, "b@example.com", "EMAIL")));
        dispatchSucceedsExceptFor("FAX");

        processor.process(new BulkNotificationJobMessage(jobId));

        BulkJob result = repository.job(jobId);
        assertEquals(BulkJobStatus.COMPLETED, result.status());
        assertEquals(3, result.processedCount());
        assertEquals(2, result.successCount());
        assertEquals(1, result.failedCount());
        assertEquals(NOW, result.startedAt());
        assertEquals(NOW, result.completedAt());
        assertNull(result.lockedBy());
        assertEquals(NotificationStatus.FAILED, repository.item(jobId, 1).status());
        assertEquals(NotificationStatus.SENT, repository.item(jobId, 2).status());

        List<String> errors = repository.errors(jobId);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("2026-03-01 10:15:30: Item +15550001111: "), errors.get(0));
        assertTrue(errors.get(0).contains("FAX"));
    }

    @Test
    void testProcess_DispatchesItemsInCreationOrder() throws Exception {
        UUID jobId = UUID.randomUUID();
        repository.save(job(jobId, BulkJobStatus.PENDING, 3, null, null), List.of(
            item(jobId, 2, "third@example.com", "EMAIL"),
            item(jobId, 0, "first@example.com", "EMAIL"),
            item(jobId, 1, "second@example.com", "EMAIL")));
        List<String> order = new ArrayList<>();
        when(itemDispatcher.dispatch(any(), any())).thenAnswer(inv -> {
            order.add(inv.<BulkItem>getArgument(1).recipient());
            return UUID.randomUUID();
        });

        processor.process(new BulkNotificationJobMessage(jobId));

        assertEquals(List.of("first@example.com", "second@example.com", "third@example.com"), order);
    }

    @Test
    void testProcess_WhenRedelivered_SkipsAlreadyProcessedItems() throws Exception {
        UUID jobId = UUID.randomUUID();
        repository.save(job(jobId, BulkJobStatus.PENDING, 3, null, null), List.of(
            item(jobId, 0, "a@example.com", "EMAIL"),
            item(jobId, 1, "+15550001111", "FAX"),
            item(jobId, 2, "b@example.com", "EMAIL")));
        dispatchSucceedsExceptFor("FAX");
        processor.process(new BulkNotificationJobMessage(jobId));

        // a crash before completion leaves the job PROCESSING under this worker
        BulkJob done = repository.job(jobId);
        repository.jobs.put(jobId, new BulkJob(jobId, done.name(), BulkJobStatus.PROCESSING, done.totalCount(),
            done.processedCount(), done.successCount(), done.failedCount(), done.startedAt(), null,
            "worker-a", NOW.plusMinutes(5)));
        clearInvocations(itemDispatcher);

        processor.process(new BulkNotificationJobMessage(jobId));

        verify(itemDispatcher, never()).dispatch(any(), any());
        BulkJob result = repository.job(jobId);
        assertEquals(BulkJobStatus.COMPLETED, result.status());
        assertEquals(3, result.processedCount());
        assertEquals(2, result.successCount());
        assertEquals(1, result.failedCount());
        assertEquals(1, repository.errors(jobId).size());
    }

    @Test
    void testProcess_WhenJobCancelled_SkipsWithoutChanges() throws Exception {
        UUID jobId = UUID.randomUUID();
        repository.save(job(jobId, BulkJobStatus.CANCELLED, 1, null, null),
            List.of(item(jobId, 0, "a@example.com", "EMAIL")));

        processor.process(new BulkNotificationJobMessage(jobId));

        verifyNoInteractions(itemDispatcher);
        assertEquals(BulkJobStatus.CANCELLED, repository.job(jobId).status());
        assertEquals(NotificationStatus.PENDING, repository.item(jobId, 0).status());
    }

    @Test
    void testProcess_WhenJobCompleted_SkipsWithoutChanges() throws Exception {
        UUID jobId = UUID.randomUUID();
        repository.save(job(jobId, BulkJobStatus.COMPLETED, 0, null, null), List.of());

        processor.process(new BulkNotificationJobMessage(jobId));

        verifyNoInteractions(itemDispatcher);
        assertEquals(BulkJobStatus.COMPLETED, repository.job(jobId).status());
    }

    @Test
    void testProcess_WhenJobMissing_ThrowsNotFound() {
        UUID jobId = UUID.randomUUID();

        BulkJobNotFoundException ex = assertThrows(BulkJobNotFoundException.class,
            () -> processor.process(new BulkNotificationJobMessage(jobId)));

        assertEquals(jobId, ex.getJobId());
    }

    @Test
    void testProcess_WhenWorkerCrashedMidRun_CompletesOnceLeaseIsReleased() throws Exception {
        UUID jobId = UUID.randomUUID();
        BulkItem sent = new BulkItem(UUID.randomUUID(), jobId, 0, "a@example.com", "EMAIL", Map.of(),
            NotificationStatus.SENT);
        repository.save(new BulkJob(jobId, "March newsletter", BulkJobStatus.PROCESSING, 2, 1, 1, 0,
                NOW.minusMinutes(1), null, "host-1111", NOW.plusMinutes(9)),
            List.of(sent, item(jobId, 1, "b@example.com", "EMAIL")));
        when(itemDispatcher.dispatch(any(), any())).thenReturn(UUID.randomUUID());

        // redelivery while the dead worker's lease is still live
        processor.process(new BulkNotificationJobMessage(jobId));

        verifyNoInteractions(itemDispatcher);
        assertEquals(BulkJobStatus.PROCESSING, repository.job(jobId).status());
        assertEquals(NotificationStatus.PENDING, repository.item(jobId, 1).status());

        // stalled-job recovery clears the expired lease and publishes a new run message
        BulkJob stalled = repository.job(jobId);
        repository.jobs.put(jobId, new BulkJob(jobId, stalled.name(), stalled.status(), stalled.totalCount(),
            stalled.processedCount(), stalled.successCount(), stalled.failedCount(), stalled.startedAt(), null,
            null, NOW.plusMinutes(10)));

        processor.process(new BulkNotificationJobMessage(jobId));

        BulkJob result = repository.job(jobId);
        assertEquals(BulkJobStatus.COMPLETED, result.status());
        assertEquals(2, result.processedCount());
        assertEquals(2, result.successCount());
        assertEquals(NOW.minusMinutes(1), result.startedAt());
        assertEquals(NotificationStatus.SENT, repository.item(jobId, 1).status());
        verify(itemDispatcher, times(1)).dispatch(any(), any());
    }

    @Test
    void testProcess_WhenOtherWorkersLeaseExpired_TakesOver() throws Exception {
        UUID jobId = UUID.randomUUID();
        repository.save(job(jobId, BulkJobStatus.PROCESSING, 1, "worker-b", NOW.minusMinutes(1)),
            List.of(item(jobId, 0, "a@example.com", "EMAIL")));
        when(itemDispatcher.dispatch(any(), any())).thenReturn(UUID.randomUUID());

        processor.process(new BulkNotificationJobMessage(jobId));

        assertEquals(BulkJobStatus.COMPLETED, repository.job(jobId).status());
        assertEquals(1, repository.job(jobId).successCount());
    }

    @Test
    void testProcess_RenewsLeaseAtEachProgressCheckpoint() throws Exception {
        properties.setProgressInterval(2);
        UUID jobId = UUID.randomUUID();
        List<BulkItem> items = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            items.add(item(jobId, i, "user" + i + "@example.com", "EMAIL"));
        }
        repository.save(job(jobId, BulkJobStatus.PENDING, 5, null, null), items);
        when(itemDispatcher.dispatch(any(), any())).thenReturn(UUID.randomUUID());

        processor.process(new BulkNotificationJobMessage(jobId));

        assertEquals(2, repository.leaseRenewals);
        assertEquals(5, repository.job(jobId).successCount());
    }

    @Test
    void testProcess_WhenLeaseLostMidRun_StopsWithoutCompleting() throws Exception {
        properties.setProgressInterval(1);
        UUID jobId = UUID.randomUUID();
        repository.save(job(jobId, BulkJobStatus.PENDING, 3, null, null), List.of(
            item(jobId, 0, "a@example.com", "EMAIL"),
            item(jobId, 1, "b@example.com", "EMAIL"),
            item(jobId, 2, "c@example.com", "EMAIL")));
        when(itemDispatcher.dispatch(any(), argThat(i -> i != null && i.position() == 0))).thenAnswer(inv -> {
            BulkJob current = repository.job(jobId);
            repository.jobs.put(jobId, new BulkJob(jobId, current.name(), BulkJobStatus.CANCELLED,
                current.totalCount(), current.processedCount(), current.successCount(), current.failedCount(),
                current.startedAt(), null, current.lockedBy(), current.leaseUntil()));
            return UUID.randomUUID();
        });

        processor.process(new BulkNotificationJobMessage(jobId));

        verify(itemDispatcher, times(1)).dispatch(any(), any());
        assertEquals(BulkJobStatus.CANCELLED, repository.job(jobId).status());
        assertEquals(NotificationStatus.PENDING, repository.item(jobId, 1).status());
    }

    @Test
    void testProcess_WhenJobHasNoItems_CompletesImmediately() throws Exception {
        UUID jobId = UUID.randomUUID();
        repository.save(job(jobId, BulkJobStatus.PENDING, 0, null, null), List.of());

        processor.process(new BulkNotificationJobMessage(jobId));

        assertEquals(BulkJobStatus.COMPLETED, repository.job(jobId).status());
        assertEquals(0, repository.job(jobId).processedCount());
    }
}
