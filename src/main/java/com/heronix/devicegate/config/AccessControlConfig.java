package com.heronix.devicegate.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.heronix.devicegate.service.DeviceAccessManager;

/**
 * Wires the access control manager from configuration.
 *
 * The manager holds all registry state for the lifetime of the process; there
 * is exactly one per application context.
 */
@Configuration
public class AccessControlConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DeviceAccessManager deviceAccessManager(DeviceGateProperties properties, Clock clock) {
        return new DeviceAccessManager(properties.getAccess().toPolicy(), clock);
    }
}
