package com.heronix.devicegate.model.domain;

import java.time.Instant;

/**
 * Bearer credential issued to a device on registration.
 *
 * At most one live token exists per device; a new registration supersedes
 * the previous one.
 */
public record AuthToken(
        String deviceId,
        String value,
        Instant issuedAt,
        Instant expiresAt
) {

    /**
     * A token is expired once {@code now} is strictly after its expiry.
     */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }
}
