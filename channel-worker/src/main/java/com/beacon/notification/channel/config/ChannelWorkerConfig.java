package com.beacon.notification.channel.config;

import com.beacon.notification.channel.handler.ChannelFailureMarker;
import com.beacon.notification.channel.handler.EmailMessageHandler;
import com.beacon.notification.channel.handler.PushMessageHandler;
import com.beacon.notification.channel.handler.SmsMessageHandler;
import com.beacon.notification.channel.provider.ProviderProperties;
import com.beacon.notification.common.message.EmailChannelMessage;
import com.beacon.notification.common.message.PushChannelMessage;
import com.beacon.notification.common.message.SmsChannelMessage;
import com.beacon.notification.common.messaging.QueueConsumerFactory;
import com.beacon.notification.common.messaging.QueueNames;
import com.beacon.notification.common.messaging.QueueTopology;
import com.beacon.notification.common.status.ChannelStatusUpdater;
import com.beacon.notification.common.status.JdbcChannelStatusUpdater;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * One consumer container per channel queue. Each container runs a single consumer
 * thread, so messages of one channel are delivered one at a time.
 */
@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ChannelWorkerConfig {

    @Bean
    public Declarables channelQueues() {
        List<Declarable> declarables = new ArrayList<>();
        for (String queue : List.of(QueueNames.EMAIL, QueueNames.SMS, QueueNames.PUSH)) {
            declarables.addAll(QueueTopology.declarables(queue).getDeclarables());
        }
        return new Declarables(declarables);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChannelStatusUpdater channelStatusUpdater(JdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcChannelStatusUpdater(jdbcTemplate, clock);
    }

    @Bean
    public SimpleMessageListenerContainer emailConsumer(QueueConsumerFactory factory,
                                                        EmailMessageHandler handler,
                                                        ChannelFailureMarker failureMarker) {
        return factory.createContainer(QueueNames.EMAIL, EmailChannelMessage.class, handler, failureMarker::markFailed);
    }

    @Bean
    public SimpleMessageListenerContainer smsConsumer(QueueConsumerFactory factory,
                                                      SmsMessageHandler handler,
                                                      ChannelFailureMarker failureMarker) {
        return factory.createContainer(QueueNames.SMS, SmsChannelMessage.class, handler, failureMarker::markFailed);
    }

    @Bean
    public SimpleMessageListenerContainer pushConsumer(QueueConsumerFactory factory,
                                                       PushMessageHandler handler,
                                                       ChannelFailureMarker failureMarker) {
        return factory.createContainer(QueueNames.PUSH, PushChannelMessage.class, handler, failureMarker::markFailed);
    }
}
