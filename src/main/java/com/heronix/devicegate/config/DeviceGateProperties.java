package com.heronix.devicegate.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.heronix.devicegate.model.domain.AccessPolicy;

import lombok.Data;

/**
 * Configuration properties for Heronix DeviceGate.
 */
@Data
@ConfigurationProperties(prefix = "heronix.devicegate")
public class DeviceGateProperties {

    /**
     * Registration and whitelist settings (initial values, changeable at runtime)
     */
    private AccessConfig access = new AccessConfig();

    /**
     * Periodic sweep configuration
     */
    private SweepConfig sweep = new SweepConfig();

    /**
     * Device event log configuration
     */
    private EventsConfig events = new EventsConfig();

    @Data
    public static class AccessConfig {
        /**
         * Failed registrations allowed per address inside one cooldown window.
         * Twice this many failures blacklists the address.
         */
        private int maxRegistrationAttempts = AccessPolicy.DEFAULT_MAX_REGISTRATION_ATTEMPTS;

        /**
         * Window after which an address's attempt count resets
         */
        private Duration registrationCooldown = AccessPolicy.DEFAULT_REGISTRATION_COOLDOWN;

        /**
         * Lifetime of an issued auth token
         */
        private Duration tokenExpiry = AccessPolicy.DEFAULT_TOKEN_EXPIRY;

        /**
         * Reject data submissions from any address other than the registered one
         */
        private boolean requireUniqueAddresses = false;

        /**
         * Only registered devices may submit data
         */
        private boolean enableWhitelist = true;

        public AccessPolicy toPolicy() {
            return AccessPolicy.builder()
                    .maxRegistrationAttempts(maxRegistrationAttempts)
                    .registrationCooldown(registrationCooldown)
                    .tokenExpiry(tokenExpiry)
                    .requireUniqueAddresses(requireUniqueAddresses)
                    .enableWhitelist(enableWhitelist)
                    .build();
        }
    }

    @Data
    public static class SweepConfig {
        /**
         * Enable the scheduled sweep
         */
        private boolean enabled = true;

        /**
         * Sweep interval in milliseconds (default: hourly)
         */
        private long intervalMs = 3_600_000L;
    }

    @Data
    public static class EventsConfig {
        /**
         * Write registration and submission events to the event log
         */
        private boolean enabled = true;

        /**
         * Event log retention in days
         */
        private int retentionDays = 30;
    }
}
