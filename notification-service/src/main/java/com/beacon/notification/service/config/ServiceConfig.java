package com.beacon.notification.service.config;

import com.beacon.notification.common.messaging.QueueNames;
import com.beacon.notification.common.messaging.QueueTopology;
import com.beacon.notification.service.deadletter.DeadLetterProperties;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
@EnableConfigurationProperties(DeadLetterProperties.class)
public class ServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Main queues, dead-letter exchanges and dead-letter queues for every channel and the bulk queue.
     * Declared here as well as in the workers so reprocessing works before any worker has started.
     */
    @Bean
    public Declarables notificationQueues() {
        List<Declarable> declarables = new ArrayList<>();
        for (String queue : QueueNames.mainQueues()) {
            declarables.addAll(QueueTopology.declarables(queue).getDeclarables());
        }
        return new Declarables(declarables);
    }
}
