package com.beacon.notification.bulk.repository;

import com.beacon.notification.common.message.EmailChannelMessage;
import com.beacon.notification.common.message.PushChannelMessage;
import com.beacon.notification.common.message.SmsChannelMessage;
import com.beacon.notification.common.model.NotificationStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persists the per-recipient notification and its channel row before the channel
 * message is published, so the channel worker always finds a row to update.
 */
@Repository
@RequiredArgsConstructor
public class NotificationDispatchRepository {

    private static final String PENDING = NotificationStatus.PENDING.name();

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Transactional
    public void saveEmail(UUID bulkJobId, EmailChannelMessage message, LocalDateTime now) {
        insertNotification(message.notificationId(), bulkJobId, now);
        jdbcTemplate.update("""
                INSERT INTO email_channels (id, notification_id, recipient, subject, body, is_body_html, status, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
            message.channelId(), message.notificationId(), message.to(), message.subject(), message.body(),
            message.bodyHtml(), PENDING, now);
    }

    @Transactional
    public void saveSms(UUID bulkJobId, SmsChannelMessage message, LocalDateTime now) {
        insertNotification(message.notificationId(), bulkJobId, now);
        jdbcTemplate.update("""
                INSERT INTO sms_channels (id, notification_id, recipient, message, sender_id, status, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
            message.channelId(), message.notificationId(), message.to(), message.message(), message.senderId(),
            PENDING, now);
    }

    @Transactional
    public void savePush(UUID bulkJobId, PushChannelMessage message, LocalDateTime now) throws JsonProcessingException {
        String data = objectMapper.writeValueAsString(message.data());
        insertNotification(message.notificationId(), bulkJobId, now);
        jdbcTemplate.update("""
                INSERT INTO push_channels (id, notification_id, recipient, title, body, click_action, data, platform, status, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
            message.channelId(), message.notificationId(), message.to(), message.content().title(),
            message.content().body(), message.content().clickAction(), data, message.platform(), PENDING, now);
    }

    private void insertNotification(UUID notificationId, UUID bulkJobId, LocalDateTime now) {
        jdbcTemplate.update("INSERT INTO notifications (id, bulk_job_id, created_at) VALUES (?, ?, ?)",
            notificationId, bulkJobId, now);
    }
}
