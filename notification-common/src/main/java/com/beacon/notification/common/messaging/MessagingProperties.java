package com.beacon.notification.common.messaging;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Consumer settings shared by all workers.
 * 
 * Maps to:
 * notification:
 *   messaging:
 *     queue-max-attempts: 3
 *     prefetch: 1
 *     shutdown-timeout: 10s
 *     in-process-retry:
 *       enabled: false
 */
@ConfigurationProperties(prefix = "notification.messaging")
@Data
public class MessagingProperties {

    /**
     * Total deliveries a message gets on its queue before it is dead-lettered.
     * Default: 3 (first delivery plus two republishes)
     */
    private int queueMaxAttempts = 3;

    /**
     * Unacknowledged messages per consumer. Default: 1
     */
    private int prefetch = 1;

    /**
     * How long a stopping container waits for the in-flight message to be acknowledged.
     */
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    private InProcessRetry inProcessRetry = new InProcessRetry();

    @Data
    public static class InProcessRetry {

        /**
         * Retry inside the consumer before falling back to queue-level retry.
         */
        private boolean enabled = false;

        private int maxRetries = 3;

        private Duration initialDelay = Duration.ofSeconds(2);

        private Duration maxDelay = Duration.ofMinutes(5);
    }
}
