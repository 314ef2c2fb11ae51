package com.beacon.notification.channel;

import com.beacon.notification.common.config.MessagingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(MessagingConfig.class)
public class ChannelWorkerApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChannelWorkerApplication.class, args);
    }
}
