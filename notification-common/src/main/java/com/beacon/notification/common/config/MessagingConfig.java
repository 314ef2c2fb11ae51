package com.beacon.notification.common.config;

import com.beacon.notification.common.messaging.MessagePublisher;
import com.beacon.notification.common.messaging.MessagingProperties;
import com.beacon.notification.common.messaging.QueueConsumerFactory;
import com.beacon.notification.common.messaging.RabbitMessagePublisher;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Messaging beans shared by every application: JSON mapper, publisher and consumer factory.
 * Imported by each application class.
 */
@Configuration
@EnableConfigurationProperties(MessagingProperties.class)
public class MessagingConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public MessagePublisher messagePublisher(RabbitTemplate rabbitTemplate, ObjectMapper objectMapper) {
        return new RabbitMessagePublisher(rabbitTemplate, objectMapper);
    }

    @Bean
    public QueueConsumerFactory queueConsumerFactory(ConnectionFactory connectionFactory,
                                                     RabbitTemplate rabbitTemplate,
                                                     ObjectMapper objectMapper,
                                                     MeterRegistry meterRegistry,
                                                     MessagingProperties properties) {
        return new QueueConsumerFactory(connectionFactory, rabbitTemplate, objectMapper, meterRegistry, properties);
    }
}
