package com.heronix.devicegate.model.enums;

/**
 * Lifecycle status of a registered device.
 *
 * A device stays ACTIVE for as long as it is in the registry; removal is
 * the only way out.
 */
public enum DeviceStatus {

    /**
     * Device is registered and may submit data
     */
    ACTIVE
}
