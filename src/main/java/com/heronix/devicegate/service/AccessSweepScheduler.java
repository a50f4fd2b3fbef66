package com.heronix.devicegate.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.heronix.devicegate.config.DeviceGateProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the periodic maintenance of the access control state.
 */
@Component
@ConditionalOnProperty(prefix = "heronix.devicegate.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AccessSweepScheduler {

    private final DeviceAccessManager accessManager;
    private final DeviceEventService eventService;
    private final DeviceGateProperties properties;

    // Hourly by default, first run one interval after startup
    @Scheduled(fixedRateString = "${heronix.devicegate.sweep.interval-ms:3600000}",
            initialDelayString = "${heronix.devicegate.sweep.interval-ms:3600000}")
    public void sweep() {
        DeviceAccessManager.SweepReport report = accessManager.cleanup();
        log.debug("DEVICE_SWEEP: Sweep done - {} expired tokens, {} stale counters",
                report.expiredTokens(), report.staleCounters());
    }

    // Daily at 03:30
    @Scheduled(cron = "0 30 3 * * *")
    public void purgeEvents() {
        int retentionDays = properties.getEvents().getRetentionDays();
        try {
            eventService.purgeOlderThan(retentionDays);
        } catch (Exception e) {
            log.error("DEVICE_SWEEP: Event log purge failed: {}", e.getMessage());
        }
    }
}
