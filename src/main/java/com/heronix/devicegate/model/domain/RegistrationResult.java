package com.heronix.devicegate.model.domain;

import java.time.Duration;
import java.util.List;

import com.heronix.devicegate.model.enums.AccessDenialReason;

/**
 * Outcome of a registration attempt.
 *
 * On success {@code device} and {@code authToken} are set and {@code reason}
 * is null. On failure {@code reason} is set, and {@code retryAfter} only for
 * {@link AccessDenialReason#RATE_LIMITED}.
 */
public record RegistrationResult(
        boolean success,
        String message,
        DeviceRecord device,
        String authToken,
        List<String> warnings,
        AccessDenialReason reason,
        Duration retryAfter
) {

    public static final String SAME_ADDRESS_WARNING = "Device re-registered from same address";

    public static RegistrationResult registered(DeviceRecord device, String authToken, List<String> warnings) {
        return new RegistrationResult(true, "Device registered successfully", device, authToken,
                List.copyOf(warnings), null, null);
    }

    public static RegistrationResult denied(AccessDenialReason reason, String message) {
        return new RegistrationResult(false, message, null, null, List.of(), reason, null);
    }

    public static RegistrationResult rateLimited(Duration retryAfter) {
        return new RegistrationResult(false, AccessDenialReason.RATE_LIMITED.getDescription(), null, null,
                List.of(), AccessDenialReason.RATE_LIMITED, retryAfter);
    }

    /**
     * Retry-after rounded up to whole seconds and never below one, or null
     * when not rate limited. The window is still closed at the exact moment
     * the cooldown elapses.
     */
    public Long retryAfterSeconds() {
        if (retryAfter == null) {
            return null;
        }
        long seconds = retryAfter.getSeconds();
        if (retryAfter.getNano() > 0) {
            seconds++;
        }
        return Math.max(1L, seconds);
    }
}
