package com.beacon.notification.service.bulk;

import com.beacon.notification.common.model.BulkJobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduledBulkJobDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final LocalDateTime NOW_UTC = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private BulkNotificationJobRepository jobRepository;

    @Mock
    private BulkJobRunPublisher runPublisher;

    private ScheduledBulkJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ScheduledBulkJobDispatcher(jobRepository, runPublisher, Clock.fixed(NOW, ZoneOffset.UTC), 50);
    }

    @Test
    void testDispatchDueJobs_ReleasesClaimedJobsOnly() {
        UUID claimed = UUID.randomUUID();
        UUID cancelledMeanwhile = UUID.randomUUID();
        when(jobRepository.findDueJobIds(eq(BulkJobStatus.SCHEDULED), eq(NOW_UTC), any(Pageable.class)))
            .thenReturn(List.of(claimed, cancelledMeanwhile));
        when(jobRepository.transition(claimed, BulkJobStatus.SCHEDULED, BulkJobStatus.PENDING, NOW_UTC)).thenReturn(1);
        when(jobRepository.transition(cancelledMeanwhile, BulkJobStatus.SCHEDULED, BulkJobStatus.PENDING, NOW_UTC)).thenReturn(0);

        dispatcher.dispatchDueJobs();

        verify(runPublisher).publishAfterCommit(claimed);
        verify(runPublisher, never()).publishAfterCommit(cancelledMeanwhile);
    }

    @Test
    void testDispatchDueJobs_WhenNothingDue_DoesNothing() {
        when(jobRepository.findDueJobIds(any(), any(), any())).thenReturn(List.of());

        dispatcher.dispatchDueJobs();

        verify(jobRepository, never()).transition(any(), any(), any(), any());
        verifyNoInteractions(runPublisher);
    }

    @Test
    void testReleaseJob_WhenClaimFails_ReturnsFalse() {
        UUID jobId = UUID.randomUUID();
        when(jobRepository.transition(jobId, BulkJobStatus.SCHEDULED, BulkJobStatus.PENDING, NOW_UTC)).thenReturn(0);

        assertFalse(dispatcher.releaseJob(jobId));
    }
}
