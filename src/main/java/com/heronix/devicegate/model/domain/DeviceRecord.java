package com.heronix.devicegate.model.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.heronix.devicegate.model.enums.DeviceStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A registered device identity.
 *
 * Instances held by {@link com.heronix.devicegate.service.DeviceAccessManager}
 * are mutated only under its lock. Everything handed out to callers is a
 * {@link #snapshot()} copy.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceRecord {

    /**
     * Caller chosen identity, case-sensitive, never changes.
     */
    private String deviceId;

    /**
     * Last known reachable address of the device.
     */
    private String address;

    /**
     * Last known port of the device.
     */
    private int port;

    /**
     * When the device was first registered.
     */
    private Instant registeredAt;

    /**
     * Network origin of the first registration. Never changes, even when
     * {@link #address} is refreshed.
     */
    private String registeredFromAddress;

    /**
     * Updated on every refresh and every accepted submission.
     */
    private Instant lastSeenAt;

    /**
     * Free-form descriptive attributes (type, location, firmware...).
     */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private DeviceStatus status = DeviceStatus.ACTIVE;

    /**
     * Number of accepted data submissions.
     */
    private long submissionCount;

    private Instant lastSubmissionAt;

    /**
     * Shallow-merge new attributes over the existing ones.
     */
    public void mergeMetadata(Map<String, Object> update) {
        if (update == null || update.isEmpty()) {
            return;
        }
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(update);
        this.metadata = merged;
    }

    /**
     * Record an accepted data submission.
     */
    public void recordSubmission(Instant now) {
        this.submissionCount++;
        this.lastSubmissionAt = now;
        this.lastSeenAt = now;
    }

    /**
     * Detached copy safe to hand outside the manager lock.
     */
    public DeviceRecord snapshot() {
        return DeviceRecord.builder()
                .deviceId(deviceId)
                .address(address)
                .port(port)
                .registeredAt(registeredAt)
                .registeredFromAddress(registeredFromAddress)
                .lastSeenAt(lastSeenAt)
                .metadata(new LinkedHashMap<>(metadata))
                .status(status)
                .submissionCount(submissionCount)
                .lastSubmissionAt(lastSubmissionAt)
                .build();
    }
}
