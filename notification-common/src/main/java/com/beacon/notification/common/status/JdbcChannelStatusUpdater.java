package com.beacon.notification.common.status;

import com.beacon.notification.common.model.ChannelType;
import com.beacon.notification.common.model.NotificationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * JDBC status updates for the email, SMS and push channel tables.
 * The channel kind selects a statically-typed update per table.
 * Timestamps are taken from the injected clock, UTC in every application.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcChannelStatusUpdater implements ChannelStatusUpdater {

    private static final String UPDATE_EMAIL = """
        UPDATE email_channels
        SET status = ?, error_message = ?, updated_at = ?,
            sent_at = CASE WHEN ? = 'SENT' THEN ? ELSE sent_at END
        WHERE id = ? AND notification_id = ?
        """;

    private static final String UPDATE_SMS = """
        UPDATE sms_channels
        SET status = ?, error_message = ?, updated_at = ?,
            sent_at = CASE WHEN ? = 'SENT' THEN ? ELSE sent_at END
        WHERE id = ? AND notification_id = ?
        """;

    private static final String UPDATE_PUSH = """
        UPDATE push_channels
        SET status = ?, error_message = ?, updated_at = ?,
            sent_at = CASE WHEN ? = 'SENT' THEN ? ELSE sent_at END
        WHERE id = ? AND notification_id = ?
        """;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    public boolean updateChannelStatus(ChannelType channelType, UUID notificationId, UUID channelId,
                                       NotificationStatus status, String errorMessage) {
        int updated = switch (channelType) {
            case EMAIL -> updateEmail(notificationId, channelId, status, errorMessage);
            case SMS -> updateSms(notificationId, channelId, status, errorMessage);
            case PUSH -> updatePush(notificationId, channelId, status, errorMessage);
        };
        if (updated == 0) {
            log.warn("No {} channel {} found for notification {}", channelType, channelId, notificationId);
            return false;
        }
        log.debug("Updated {} channel {} to {}", channelType, channelId, status);
        return true;
    }

    int updateEmail(UUID notificationId, UUID channelId, NotificationStatus status, String errorMessage) {
        return update(UPDATE_EMAIL, notificationId, channelId, status, errorMessage);
    }

    int updateSms(UUID notificationId, UUID channelId, NotificationStatus status, String errorMessage) {
        return update(UPDATE_SMS, notificationId, channelId, status, errorMessage);
    }

    int updatePush(UUID notificationId, UUID channelId, NotificationStatus status, String errorMessage) {
        return update(UPDATE_PUSH, notificationId, channelId, status, errorMessage);
    }

    private int update(String sql, UUID notificationId, UUID channelId, NotificationStatus status, String errorMessage) {
        LocalDateTime now = LocalDateTime.now(clock);
        return jdbcTemplate.update(sql,
            status.name(), errorMessage, now,
            status.name(), now,
            channelId, notificationId);
    }
}
