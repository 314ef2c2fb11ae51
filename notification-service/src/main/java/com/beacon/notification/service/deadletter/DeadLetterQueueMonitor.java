package com.beacon.notification.service.deadletter;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically checks dead-letter queue depths.
 * Logs every non-empty queue and warns once a queue reaches the alert threshold.
 * Depths are also exported as {@code notification.dlq.depth{queue}}.
 */
@Component
@ConditionalOnProperty(prefix = "notification.dead-letter.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueMonitor {

    private final DeadLetterQueueService deadLetterQueueService;
    private final DeadLetterProperties properties;
    private final MeterRegistry meterRegistry;

    private final Map<String, AtomicLong> depths = new ConcurrentHashMap<>();

    @Scheduled(
        fixedDelayString = "${notification.dead-letter.monitor.interval:PT5M}",
        initialDelayString = "${notification.dead-letter.monitor.initial-delay:PT30S}")
    public void checkDeadLetterQueues() {
        List<DeadLetterQueueStats> stats;
        try {
            stats = deadLetterQueueService.stats();
        } catch (Exception e) {
            log.error("Error monitoring dead-letter queues", e);
            return;
        }

        int threshold = properties.getMonitor().getAlertThreshold();
        for (DeadLetterQueueStats queue : stats) {
            depth(queue.queueName()).set(queue.messageCount());
            if (queue.messageCount() >= threshold) {
                log.warn("Dead-letter queue {} has {} messages (threshold {}), investigate failed deliveries",
                    queue.queueName(), queue.messageCount(), threshold);
            } else if (queue.messageCount() > 0) {
                log.info("Dead-letter queue {} has {} messages", queue.queueName(), queue.messageCount());
            }
        }
    }

    long currentDepth(String queueName) {
        AtomicLong depth = depths.get(queueName);
        return depth != null ? depth.get() : 0;
    }

    private AtomicLong depth(String queueName) {
        return depths.computeIfAbsent(queueName, name -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder("notification.dlq.depth", value, AtomicLong::get)
                .description("Messages waiting in a dead-letter queue")
                .tag("queue", name)
                .register(meterRegistry);
            return value;
        });
    }
}
