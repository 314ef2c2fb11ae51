package com.beacon.notification.bulk.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.UUID;

@ConfigurationProperties(prefix = "notification.bulk")
@Data
@Slf4j
public class BulkWorkerProperties {

    /**
     * Identifies this worker instance in the job lease. Must differ between instances.
     */
    private String workerId = defaultWorkerId();

    /**
     * How long a claimed job stays locked without a renewal.
     */
    private Duration leaseDuration = Duration.ofMinutes(10);

    /**
     * Items between progress log lines and lease renewals.
     */
    private int progressInterval = 100;

    static String defaultWorkerId() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + suffix;
        } catch (UnknownHostException e) {
            log.warn("Could not resolve host name for worker id: {}", e.getMessage());
            return "bulk-worker-" + suffix;
        }
    }
}
