package com.heronix.devicegate.model.domain;

import com.heronix.devicegate.model.enums.AccessDenialReason;

/**
 * Outcome of checking a data submission against the whitelist.
 *
 * {@code device} is a snapshot taken right after the submission was counted;
 * it is null on failure, and also null when the whitelist is disabled and the
 * device was never registered.
 */
public record SubmissionValidation(
        boolean allowed,
        AccessDenialReason reason,
        String message,
        DeviceRecord device
) {

    public static SubmissionValidation allowed(DeviceRecord device) {
        return new SubmissionValidation(true, null, null, device);
    }

    public static SubmissionValidation denied(AccessDenialReason reason, String message) {
        return new SubmissionValidation(false, reason, message, null);
    }
}
