package com.heronix.devicegate.model.enums;

/**
 * Kinds of entries written to the device event log.
 */
public enum DeviceEventType {
    DEVICE_REGISTRATION,
    DATA_RECEIVED,
    DEVICE_UNREGISTERED,
    ADDRESS_BLACKLISTED,
    ADDRESS_UNBLACKLISTED,
    CONFIG_UPDATED
}
