package com.heronix.devicegate.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.devicegate.model.dto.AccessStatsDTO;
import com.heronix.devicegate.service.DeviceAccessManager;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for device access control.
 *
 * Always UP; the details show whether the whitelist is enforced and how big
 * the registry and blacklist are.
 */
@Component
@RequiredArgsConstructor
public class DeviceGateHealthIndicator implements HealthIndicator {

    private final DeviceAccessManager accessManager;

    @Override
    public Health health() {
        AccessStatsDTO stats = accessManager.stats();

        return Health.up()
                .withDetail("whitelist", stats.getConfig().enableWhitelist() ? "enforced" : "open")
                .withDetail("strict-addresses", stats.getConfig().requireUniqueAddresses())
                .withDetail("registered-devices", stats.getTotalRegistered())
                .withDetail("active-devices", stats.getActiveDevices())
                .withDetail("blacklisted-addresses", stats.getBlacklistedAddresses())
                .build();
    }
}
