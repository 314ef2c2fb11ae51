package com.beacon.notification.bulk.processor;

import com.beacon.notification.bulk.repository.BulkItem;
import com.beacon.notification.bulk.repository.NotificationDispatchRepository;
import com.beacon.notification.common.message.EmailChannelMessage;
import com.beacon.notification.common.message.PushChannelMessage;
import com.beacon.notification.common.message.SmsChannelMessage;
import com.beacon.notification.common.messaging.MessagePublisher;
import com.beacon.notification.common.messaging.QueueNames;
import com.beacon.notification.common.model.ChannelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Turns one bulk item into a channel notification: builds the payload from the
 * recipient and the item's variables, stores the notification and channel rows,
 * then publishes the channel message.
 * 
 * Variables override the defaults: {@code subject}/{@code body} for email,
 * {@code message}/{@code senderId} for SMS and {@code title}/{@code body}/{@code clickAction}/
 * {@code platform} for push. Push messages carry the full variable map as data.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BulkItemDispatcher {

    static final String DEFAULT_SUBJECT = "Notification";
    static final String DEFAULT_EMAIL_BODY = "Check your notification";
    static final String DEFAULT_TITLE = "Notification";
    static final String DEFAULT_MESSAGE = "You have a new notification";
    static final String DEFAULT_PLATFORM = "fcm";

    private final NotificationDispatchRepository dispatchRepository;
    private final MessagePublisher messagePublisher;
    private final Clock clock;

    /**
     * @return id of the created notification
     * @throws com.beacon.notification.common.model.UnsupportedChannelException when the item's channel is unknown
     */
    public UUID dispatch(UUID jobId, BulkItem item) throws Exception {
        ChannelType channel = ChannelType.parse(item.channel());
        UUID notificationId = UUID.randomUUID();
        UUID channelId = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.now(clock);

        Object message = switch (channel) {
            case EMAIL -> {
                EmailChannelMessage email = new EmailChannelMessage(channelId, notificationId, item.recipient(),
                    item.variable("subject", DEFAULT_SUBJECT), item.variable("body", DEFAULT_EMAIL_BODY), false);
                dispatchRepository.saveEmail(jobId, email, now);
                yield email;
            }
            case SMS -> {
                SmsChannelMessage sms = new SmsChannelMessage(channelId, notificationId, item.recipient(),
                    item.variable("message", DEFAULT_MESSAGE), item.variable("senderId", null));
                dispatchRepository.saveSms(jobId, sms, now);
                yield sms;
            }
            case PUSH -> {
                PushChannelMessage push = new PushChannelMessage(channelId, notificationId, item.recipient(),
                    new PushChannelMessage.PushContent(
                        item.variable("title", DEFAULT_TITLE),
                        item.variable("body", DEFAULT_MESSAGE),
                        item.variable("clickAction", null)),
                    item.variables(), item.variable("platform", DEFAULT_PLATFORM),
                    null, null, null, null, null);
                dispatchRepository.savePush(jobId, push, now);
                yield push;
            }
        };

        messagePublisher.publish(QueueNames.forChannel(channel), message);
        log.debug("Dispatched {} notification {} for bulk item {}", channel, notificationId, item.id());
        return notificationId;
    }
}
