package com.beacon.notification.bulk.repository;

import com.beacon.notification.common.model.BulkJobStatus;
import com.beacon.notification.common.model.NotificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcBulkJobRepository implements BulkJobRepository {

    private static final String TERMINAL_STATUSES = "('COMPLETED', 'FAILED', 'CANCELLED')";

    private static final RowMapper<BulkJob> JOB_MAPPER = (rs, rowNum) -> new BulkJob(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        BulkJobStatus.valueOf(rs.getString("status")),
        rs.getInt("total_count"),
        rs.getInt("processed_count"),
        rs.getInt("success_count"),
        rs.getInt("failed_count"),
        rs.getObject("started_at", LocalDateTime.class),
        rs.getObject("completed_at", LocalDateTime.class),
        rs.getString("locked_by"),
        rs.getObject("lease_until", LocalDateTime.class)
    );

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<BulkJob> findJob(UUID jobId) {
        String sql = """
            SELECT id, name, status, total_count, processed_count, success_count, failed_count,
                   started_at, completed_at, locked_by, lease_until
            FROM bulk_notification_jobs
            WHERE id = ?
            """;
        List<BulkJob> jobs = jdbcTemplate.query(sql, JOB_MAPPER, jobId);
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public boolean claimLease(UUID jobId, String workerId, LocalDateTime now, LocalDateTime leaseUntil) {
        String sql = """
            UPDATE bulk_notification_jobs
            SET status = 'PROCESSING',
                started_at = COALESCE(started_at, ?),
                locked_by = ?,
                lease_until = ?,
                updated_at = ?
            WHERE id = ?
              AND status NOT IN %s
              AND (locked_by IS NULL OR lease_until IS NULL OR lease_until < ? OR locked_by = ?)
            """.formatted(TERMINAL_STATUSES);
        return jdbcTemplate.update(sql, now, workerId, leaseUntil, now, jobId, now, workerId) == 1;
    }

    @Override
    public boolean renewLease(UUID jobId, String workerId, LocalDateTime now, LocalDateTime leaseUntil) {
        String sql = """
            UPDATE bulk_notification_jobs
            SET lease_until = ?, updated_at = ?
            WHERE id = ? AND status = 'PROCESSING' AND locked_by = ?
            """;
        return jdbcTemplate.update(sql, leaseUntil, now, jobId, workerId) == 1;
    }

    @Override
    public List<BulkItem> findItems(UUID jobId) {
        Map<UUID, Map<String, String>> variables = new HashMap<>();
        jdbcTemplate.query("""
                SELECT v.item_id, v.name, v.value
                FROM bulk_notification_item_variables v
                JOIN bulk_notification_items i ON i.id = v.item_id
                WHERE i.job_id = ?
                """,
            (RowCallbackHandler) rs -> {
                variables.computeIfAbsent(rs.getObject("item_id", UUID.class), id -> new LinkedHashMap<>())
                    .put(rs.getString("name"), rs.getString("value"));
            },
            jobId);

        String sql = """
            SELECT id, job_id, position, recipient, channel, status
            FROM bulk_notification_items
            WHERE job_id = ?
            ORDER BY position ASC
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            UUID itemId = rs.getObject("id", UUID.class);
            return new BulkItem(
                itemId,
                rs.getObject("job_id", UUID.class),
                rs.getInt("position"),
                rs.getString("recipient"),
                rs.getString("channel"),
                variables.get(itemId),
                NotificationStatus.valueOf(rs.getString("status")));
        }, jobId);
    }

    @Override
    public boolean markItemSent(UUID itemId, UUID notificationId, LocalDateTime now) {
        String sql = """
            UPDATE bulk_notification_items
            SET status = 'SENT', sent_at = ?, notification_id = ?, error_message = NULL, updated_at = ?
            WHERE id = ? AND status = 'PENDING'
            """;
        return jdbcTemplate.update(sql, now, notificationId, now, itemId) == 1;
    }

    @Override
    public boolean markItemFailed(UUID itemId, String errorMessage, LocalDateTime now) {
        String sql = """
            UPDATE bulk_notification_items
            SET status = 'FAILED', error_message = ?, updated_at = ?
            WHERE id = ? AND status = 'PENDING'
            """;
        return jdbcTemplate.update(sql, errorMessage, now, itemId) == 1;
    }

    @Override
    public void incrementSuccess(UUID jobId, LocalDateTime now) {
        String sql = """
            UPDATE bulk_notification_jobs
            SET success_count = success_count + 1,
                processed_count = processed_count + 1,
                updated_at = ?
            WHERE id = ? AND processed_count < total_count
            """;
        if (jdbcTemplate.update(sql, now, jobId) == 0) {
            log.warn("Success counter for bulk job {} not incremented: processed count already at total", jobId);
        }
    }

    @Override
    public void incrementFailure(UUID jobId, LocalDateTime now) {
        String sql = """
            UPDATE bulk_notification_jobs
            SET failed_count = failed_count + 1,
                processed_count = processed_count + 1,
                updated_at = ?
            WHERE id = ? AND processed_count < total_count
            """;
        if (jdbcTemplate.update(sql, now, jobId) == 0) {
            log.warn("Failure counter for bulk job {} not incremented: processed count already at total", jobId);
        }
    }

    @Override
    public void appendError(UUID jobId, String error) {
        String sql = """
            INSERT INTO bulk_notification_job_errors (job_id, position, message)
            SELECT ?, COALESCE(MAX(position), -1) + 1, ?
            FROM bulk_notification_job_errors
            WHERE job_id = ?
            """;
        jdbcTemplate.update(sql, jobId, error, jobId);
    }

    @Override
    public boolean completeJob(UUID jobId, String workerId, LocalDateTime now) {
        String sql = """
            UPDATE bulk_notification_jobs
            SET status = 'COMPLETED', completed_at = ?, locked_by = NULL, lease_until = NULL, updated_at = ?
            WHERE id = ? AND status = 'PROCESSING' AND locked_by = ?
            """;
        return jdbcTemplate.update(sql, now, now, jobId, workerId) == 1;
    }

    @Override
    public boolean failJob(UUID jobId, LocalDateTime now) {
        String sql = """
            UPDATE bulk_notification_jobs
            SET status = 'FAILED', completed_at = ?, locked_by = NULL, lease_until = NULL, updated_at = ?
            WHERE id = ? AND status NOT IN %s
            """.formatted(TERMINAL_STATUSES);
        return jdbcTemplate.update(sql, now, now, jobId) == 1;
    }
}
