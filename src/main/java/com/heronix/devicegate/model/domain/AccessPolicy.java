package com.heronix.devicegate.model.domain;

import java.time.Duration;

import lombok.Builder;

/**
 * Runtime access-control settings.
 *
 * Immutable; {@link #merge(AccessPolicyUpdate)} produces the next policy.
 * The auto-blacklist threshold is always twice {@code maxRegistrationAttempts}.
 */
@Builder(toBuilder = true)
public record AccessPolicy(
        int maxRegistrationAttempts,
        Duration registrationCooldown,
        Duration tokenExpiry,
        boolean requireUniqueAddresses,
        boolean enableWhitelist
) {

    public static final int DEFAULT_MAX_REGISTRATION_ATTEMPTS = 5;
    public static final Duration DEFAULT_REGISTRATION_COOLDOWN = Duration.ofMinutes(5);
    public static final Duration DEFAULT_TOKEN_EXPIRY = Duration.ofHours(24);

    public AccessPolicy {
        if (maxRegistrationAttempts < 1) {
            throw new IllegalArgumentException(
                    "maxRegistrationAttempts must be at least 1, was " + maxRegistrationAttempts);
        }
        requirePositive("registrationCooldown", registrationCooldown);
        requirePositive("tokenExpiry", tokenExpiry);
    }

    public static AccessPolicy defaults() {
        return new AccessPolicy(DEFAULT_MAX_REGISTRATION_ATTEMPTS, DEFAULT_REGISTRATION_COOLDOWN,
                DEFAULT_TOKEN_EXPIRY, false, true);
    }

    /**
     * Cumulative failures from one address that put it on the blacklist.
     */
    public int autoBlacklistThreshold() {
        return maxRegistrationAttempts * 2;
    }

    /**
     * Apply the fields present in {@code update}; absent fields keep their
     * current value.
     */
    public AccessPolicy merge(AccessPolicyUpdate update) {
        if (update == null) {
            return this;
        }
        AccessPolicyBuilder next = toBuilder();
        if (update.maxRegistrationAttempts() != null) {
            next.maxRegistrationAttempts(update.maxRegistrationAttempts());
        }
        if (update.registrationCooldown() != null) {
            next.registrationCooldown(update.registrationCooldown());
        }
        if (update.tokenExpiry() != null) {
            next.tokenExpiry(update.tokenExpiry());
        }
        if (update.requireUniqueAddresses() != null) {
            next.requireUniqueAddresses(update.requireUniqueAddresses());
        }
        if (update.enableWhitelist() != null) {
            next.enableWhitelist(update.enableWhitelist());
        }
        return next.build();
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, was " + value);
        }
    }
}
