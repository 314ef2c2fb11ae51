package com.beacon.notification.common.messaging;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-queue outcome counters ({@code notification.queue.messages{queue, outcome}}).
 * Counters are registered once per queue when the consumer is built.
 */
public class QueueConsumerMetrics {

    public enum Outcome {
        SUCCEEDED,
        RETRIED,
        DEAD_LETTERED,
        MALFORMED
    }

    private final Map<Outcome, Counter> counters = new EnumMap<>(Outcome.class);

    public QueueConsumerMetrics(MeterRegistry meterRegistry, String queueName) {
        for (Outcome outcome : Outcome.values()) {
            counters.put(outcome, Counter.builder("notification.queue.messages")
                .description("Messages handled by a queue consumer, by outcome")
                .tag("queue", queueName)
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
    }

    public void record(Outcome outcome) {
        counters.get(outcome).increment();
    }

    public double count(Outcome outcome) {
        return counters.get(outcome).count();
    }
}
