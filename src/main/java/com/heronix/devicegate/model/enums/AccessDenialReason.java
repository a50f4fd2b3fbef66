package com.heronix.devicegate.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a registration or data submission was refused.
 */
@Getter
@RequiredArgsConstructor
public enum AccessDenialReason {

    /**
     * Originating address is barred from registering
     */
    BLACKLISTED("Address blacklisted"),

    /**
     * Too many failed attempts from one address inside the cooldown window
     */
    RATE_LIMITED("Too many registration attempts"),

    /**
     * Device ID is already bound to a different address
     */
    IDENTITY_CONFLICT("Device ID already registered from a different address"),

    /**
     * Whitelist is enabled and the device is not registered
     */
    NOT_REGISTERED("Device is not registered or authorized"),

    /**
     * Strict address mode is on and the caller is not the bound address
     */
    ADDRESS_MISMATCH("Data submission from unauthorized address");

    /**
     * Short human readable description
     */
    private final String description;
}
