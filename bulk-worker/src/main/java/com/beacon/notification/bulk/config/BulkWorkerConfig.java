package com.beacon.notification.bulk.config;

import com.beacon.notification.bulk.processor.BulkJobFailureMarker;
import com.beacon.notification.bulk.processor.BulkJobProcessor;
import com.beacon.notification.common.message.BulkNotificationJobMessage;
import com.beacon.notification.common.messaging.QueueConsumerFactory;
import com.beacon.notification.common.messaging.QueueNames;
import com.beacon.notification.common.messaging.QueueTopology;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
@EnableConfigurationProperties(BulkWorkerProperties.class)
@Slf4j
public class BulkWorkerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The bulk queue plus the channel queues this worker publishes to.
     */
    @Bean
    public Declarables bulkWorkerQueues() {
        List<Declarable> declarables = new ArrayList<>();
        for (String queue : QueueNames.mainQueues()) {
            declarables.addAll(QueueTopology.declarables(queue).getDeclarables());
        }
        return new Declarables(declarables);
    }

    @Bean
    public SimpleMessageListenerContainer bulkJobConsumer(QueueConsumerFactory factory,
                                                          BulkJobProcessor processor,
                                                          BulkJobFailureMarker failureMarker,
                                                          BulkWorkerProperties properties) {
        log.info("Bulk worker {} consuming {} (lease {}, progress every {} items)",
            properties.getWorkerId(), QueueNames.BULK, properties.getLeaseDuration(), properties.getProgressInterval());
        return factory.createContainer(QueueNames.BULK, BulkNotificationJobMessage.class, processor,
            failureMarker::markFailed);
    }
}
