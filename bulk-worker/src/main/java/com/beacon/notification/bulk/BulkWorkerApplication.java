package com.beacon.notification.bulk;

import com.beacon.notification.common.config.MessagingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(MessagingConfig.class)
public class BulkWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BulkWorkerApplication.class, args);
    }
}
