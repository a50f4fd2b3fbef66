package com.heronix.devicegate.model.domain;

import java.time.LocalDateTime;

import com.heronix.devicegate.model.enums.DeviceEventType;
import com.heronix.devicegate.model.enums.EventOutcome;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Device Event - one entry in the registration and data submission log.
 *
 * Written by the HTTP layer after every registration, submission and
 * administrative change, whether it was accepted or not.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Entity
@Table(name = "device_events", indexes = {
    @Index(name = "idx_de_device", columnList = "device_id"),
    @Index(name = "idx_de_type", columnList = "event_type"),
    @Index(name = "idx_de_created", columnList = "created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceEvent {

    public static final int MAX_DEVICE_ID_LENGTH = 100;

    public static final int MAX_ADDRESS_LENGTH = 64;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Unique event identifier for tracking.
     */
    @Column(name = "event_id", nullable = false, unique = true, length = 36)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private DeviceEventType eventType;

    /**
     * Device the event is about, if any.
     */
    @Column(name = "device_id", length = MAX_DEVICE_ID_LENGTH)
    private String deviceId;

    /**
     * Address the device reported or the address being administered.
     */
    @Column(name = "address", length = MAX_ADDRESS_LENGTH)
    private String address;

    /**
     * Network address of the caller.
     */
    @Column(name = "client_address", length = MAX_ADDRESS_LENGTH)
    private String clientAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 10)
    private EventOutcome outcome;

    /**
     * Denial reason code for rejected events.
     */
    @Column(name = "reason", length = 30)
    private String reason;

    @Column(name = "detail", length = 500)
    private String detail;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (eventId == null) {
            eventId = java.util.UUID.randomUUID().toString();
        }
    }
}
