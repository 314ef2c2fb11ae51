package com.beacon.notification.channel.provider;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Maps to:
 * notification:
 *   providers:
 *     email:
 *       enabled: true
 *       name: smtp
 *     sms: ...
 *     push: ...
 */
@ConfigurationProperties(prefix = "notification.providers")
@Data
public class ProviderProperties {

    private Provider email = new Provider("logging-email");

    private Provider sms = new Provider("logging-sms");

    private Provider push = new Provider("logging-push");

    @Data
    public static class Provider {

        /**
         * Disabled providers make the worker skip messages of that channel.
         */
        private boolean enabled = true;

        private String name;

        /**
         * Sender used when a message does not name one (email from-address, SMS sender id).
         */
        private String defaultSender;

        public Provider() {
        }

        Provider(String name) {
            this.name = name;
        }
    }
}
