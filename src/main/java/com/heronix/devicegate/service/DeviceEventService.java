package com.heronix.devicegate.service;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.heronix.devicegate.config.DeviceGateProperties;
import com.heronix.devicegate.model.domain.DeviceEvent;
import com.heronix.devicegate.model.enums.DeviceEventType;
import com.heronix.devicegate.model.enums.EventOutcome;
import com.heronix.devicegate.repository.DeviceEventRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service for the device event log.
 *
 * Recording is best effort: a failed write is logged and swallowed so that
 * the request which produced the event still completes.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceEventService {

    private static final int MAX_DETAIL_LENGTH = 500;

    private final DeviceEventRepository eventRepository;
    private final DeviceGateProperties properties;

    /**
     * Record an event.
     *
     * @return the saved event, or null if logging is disabled or the write failed
     */
    public DeviceEvent record(DeviceEventType eventType, String deviceId, String address,
                              String clientAddress, EventOutcome outcome, String reason, String detail) {
        if (!properties.getEvents().isEnabled()) {
            return null;
        }

        DeviceEvent event = DeviceEvent.builder()
                .eventType(eventType)
                .deviceId(deviceId)
                .address(address)
                .clientAddress(clientAddress)
                .outcome(outcome)
                .reason(reason)
                .detail(truncate(detail))
                .build();

        try {
            return eventRepository.save(event);
        } catch (Exception e) {
            log.error("DEVICE_EVENTS: Failed to record {} event for device {}: {}",
                    eventType, deviceId, e.getMessage());
            return null;
        }
    }

    public DeviceEvent accepted(DeviceEventType eventType, String deviceId, String address,
                                String clientAddress, String detail) {
        return record(eventType, deviceId, address, clientAddress, EventOutcome.ACCEPTED, null, detail);
    }

    public DeviceEvent rejected(DeviceEventType eventType, String deviceId, String address,
                                String clientAddress, String reason, String detail) {
        return record(eventType, deviceId, address, clientAddress, EventOutcome.REJECTED, reason, detail);
    }

    @Transactional(readOnly = true)
    public List<DeviceEvent> recentEvents(int limit) {
        return eventRepository.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<DeviceEvent> eventsForDevice(String deviceId) {
        return eventRepository.findByDeviceIdOrderByCreatedAtDescIdDesc(deviceId);
    }

    @Transactional(readOnly = true)
    public long countByOutcome(EventOutcome outcome) {
        return eventRepository.countByOutcome(outcome);
    }

    /**
     * Delete events past the retention period.
     *
     * @return number of deleted events
     */
    @Transactional
    public int purgeOlderThan(int days) {
        int deleted = eventRepository.deleteOlderThan(LocalDateTime.now().minusDays(days));
        if (deleted > 0) {
            log.info("DEVICE_EVENTS: Purged {} events older than {} days", deleted, days);
        }
        return deleted;
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= MAX_DETAIL_LENGTH) {
            return detail;
        }
        return detail.substring(0, MAX_DETAIL_LENGTH);
    }
}
