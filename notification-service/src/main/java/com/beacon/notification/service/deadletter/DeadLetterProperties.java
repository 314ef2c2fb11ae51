package com.beacon.notification.service.deadletter;

import com.beacon.notification.common.messaging.QueueNames;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps to:
 * notification:
 *   dead-letter:
 *     queues: [email-notifications-dlq, ...]
 *     monitor:
 *       interval: 5m
 *       alert-threshold: 10
 */
@ConfigurationProperties(prefix = "notification.dead-letter")
@Data
public class DeadLetterProperties {

    /**
     * Dead-letter queues reported by stats and watched by the monitor.
     * Default: the DLQ of every main queue.
     */
    private List<String> queues = new ArrayList<>(QueueNames.deadLetterQueues());

    private Monitor monitor = new Monitor();

    @Data
    public static class Monitor {

        private boolean enabled = true;

        private Duration interval = Duration.ofMinutes(5);

        /**
         * Queue depth at which the monitor logs a warning.
         */
        private int alertThreshold = 10;
    }
}
