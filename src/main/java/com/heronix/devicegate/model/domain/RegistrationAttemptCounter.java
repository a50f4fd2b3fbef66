package com.heronix.devicegate.model.domain;

import java.time.Duration;
import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Failed registration attempts from one originating address.
 *
 * {@code count} is the windowed figure used for rate limiting and drops back
 * to zero once the cooldown has elapsed. {@code totalFailures} keeps growing
 * for as long as the counter lives and drives auto-blacklisting; it is lost
 * only when the sweep prunes the counter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationAttemptCounter {

    private String address;

    private int count;

    private int totalFailures;

    private Instant lastAttemptAt;

    public RegistrationAttemptCounter(String address) {
        this.address = address;
    }

    /**
     * Attempt count as seen at {@code now}: zero once the cooldown window has
     * elapsed since the last attempt.
     */
    public int effectiveCount(Instant now, Duration cooldown) {
        if (lastAttemptAt == null || Duration.between(lastAttemptAt, now).compareTo(cooldown) > 0) {
            return 0;
        }
        return count;
    }

    /**
     * Count one more failed attempt, restarting the window first if it had
     * lapsed.
     *
     * @return cumulative failures including this one
     */
    public int recordFailure(Instant now, Duration cooldown) {
        this.count = effectiveCount(now, cooldown) + 1;
        this.totalFailures++;
        this.lastAttemptAt = now;
        return totalFailures;
    }

    /**
     * Time left until the window resets, never negative.
     */
    public Duration remainingCooldown(Instant now, Duration cooldown) {
        if (lastAttemptAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = cooldown.minus(Duration.between(lastAttemptAt, now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Whether the sweep may drop this counter.
     */
    public boolean isStale(Instant now, Duration cooldown) {
        return lastAttemptAt == null
                || Duration.between(lastAttemptAt, now).compareTo(cooldown.multipliedBy(2)) > 0;
    }
}
