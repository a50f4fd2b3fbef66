package com.heronix.devicegate.model.enums;

/**
 * Outcome recorded with a device event.
 */
public enum EventOutcome {
    ACCEPTED,
    REJECTED
}
