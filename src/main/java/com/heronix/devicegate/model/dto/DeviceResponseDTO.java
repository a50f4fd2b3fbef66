package com.heronix.devicegate.model.dto;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import com.heronix.devicegate.model.domain.DeviceRecord;
import com.heronix.devicegate.model.enums.DeviceStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a registered device.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceResponseDTO {

    private String deviceId;

    private String address;

    private int port;

    private Instant registeredAt;

    private String registeredFromAddress;

    private Instant lastSeenAt;

    private Map<String, Object> metadata;

    private DeviceStatus status;

    private long submissionCount;

    private Instant lastSubmissionAt;

    /**
     * "online" if seen within the active window, otherwise "offline".
     */
    private String onlineStatus;

    private long offlineDurationSeconds;

    /**
     * Whether the device currently holds an auth token.
     */
    private boolean hasAuthToken;

    /**
     * Create from a device snapshot.
     */
    public static DeviceResponseDTO fromRecord(DeviceRecord record, Instant now, Duration activeWindow,
                                               boolean hasAuthToken) {
        Duration offline = Duration.between(record.getLastSeenAt(), now);
        if (offline.isNegative()) {
            offline = Duration.ZERO;
        }

        return DeviceResponseDTO.builder()
                .deviceId(record.getDeviceId())
                .address(record.getAddress())
                .port(record.getPort())
                .registeredAt(record.getRegisteredAt())
                .registeredFromAddress(record.getRegisteredFromAddress())
                .lastSeenAt(record.getLastSeenAt())
                .metadata(record.getMetadata())
                .status(record.getStatus())
                .submissionCount(record.getSubmissionCount())
                .lastSubmissionAt(record.getLastSubmissionAt())
                .onlineStatus(offline.compareTo(activeWindow) < 0 ? "online" : "offline")
                .offlineDurationSeconds(offline.getSeconds())
                .hasAuthToken(hasAuthToken)
                .build();
    }
}
