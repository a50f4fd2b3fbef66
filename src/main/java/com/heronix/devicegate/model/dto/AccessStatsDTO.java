package com.heronix.devicegate.model.dto;

import com.heronix.devicegate.model.domain.AccessPolicy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time counters of the access control state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccessStatsDTO {

    /**
     * Number of registered devices.
     */
    private long totalRegistered;

    /**
     * Devices seen within the active window.
     */
    private long activeDevices;

    /**
     * Number of blacklisted addresses.
     */
    private long blacklistedAddresses;

    /**
     * Tokens currently held, expired or not, until the next sweep.
     */
    private long liveTokens;

    /**
     * Addresses with a registration attempt counter.
     */
    private long registrationAttempts;

    private AccessPolicy config;
}
