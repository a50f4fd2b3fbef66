package com.heronix.devicegate.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.heronix.devicegate.model.domain.DeviceEvent;
import com.heronix.devicegate.model.enums.EventOutcome;

/**
 * Repository for DeviceEvent entities.
 */
@Repository
public interface DeviceEventRepository extends JpaRepository<DeviceEvent, Long> {

    /**
     * Most recent events first.
     */
    List<DeviceEvent> findAllByOrderByCreatedAtDescIdDesc(Pageable pageable);

    /**
     * Events for one device, most recent first.
     */
    List<DeviceEvent> findByDeviceIdOrderByCreatedAtDescIdDesc(String deviceId);

    long countByOutcome(EventOutcome outcome);

    /**
     * Delete events older than the cutoff.
     */
    @Modifying
    @Query("DELETE FROM DeviceEvent e WHERE e.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
