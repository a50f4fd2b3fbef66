package com.heronix.devicegate.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.heronix.devicegate.model.domain.AccessPolicy;
import com.heronix.devicegate.model.domain.AccessPolicyUpdate;
import com.heronix.devicegate.model.domain.AuthToken;
import com.heronix.devicegate.model.domain.DeviceRecord;
import com.heronix.devicegate.model.domain.EndpointInfo;
import com.heronix.devicegate.model.domain.RegistrationAttemptCounter;
import com.heronix.devicegate.model.domain.RegistrationResult;
import com.heronix.devicegate.model.domain.SubmissionValidation;
import com.heronix.devicegate.model.dto.AccessStatsDTO;
import com.heronix.devicegate.model.enums.AccessDenialReason;
import com.heronix.devicegate.model.enums.DeviceStatus;

import lombok.extern.slf4j.Slf4j;

/**
 * Device registration, whitelist and address access control.
 *
 * Owns four collections: registered devices, auth tokens, per-address
 * registration attempt counters and the address blacklist. All of them sit
 * behind one read/write lock, so every operation is linearizable. Nothing in
 * here does I/O while the lock is held; log lines are written after it is
 * released.
 *
 * Registration policy: the first registration of a device ID wins. A later
 * registration of the same ID from the same address is a refresh; from any
 * other address it is an identity conflict and counts against the caller.
 *
 * The manager never schedules anything itself. {@link #cleanup()} is meant to
 * be driven by {@link AccessSweepScheduler} or called directly.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Slf4j
public class DeviceAccessManager {

    /**
     * Devices seen within this window count as active.
     */
    public static final Duration ACTIVE_WINDOW = Duration.ofMinutes(5);

    private final Clock clock;
    private final AuthTokenGenerator tokenGenerator;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, DeviceRecord> devices = new LinkedHashMap<>();
    private final Map<String, AuthToken> tokens = new HashMap<>();
    private final Map<String, String> tokenOwners = new HashMap<>();
    private final Map<String, RegistrationAttemptCounter> attempts = new HashMap<>();
    private final Set<String> blacklist = new LinkedHashSet<>();

    private AccessPolicy policy;

    public DeviceAccessManager(AccessPolicy policy, Clock clock) {
        this(policy, clock, new AuthTokenGenerator());
    }

    public DeviceAccessManager(AccessPolicy policy, Clock clock, AuthTokenGenerator tokenGenerator) {
        this.policy = policy;
        this.clock = clock;
        this.tokenGenerator = tokenGenerator;
        log.info("DEVICE_ACCESS: Initialized - whitelist {}, max attempts {}, cooldown {}, token expiry {}",
                policy.enableWhitelist() ? "enabled" : "disabled",
                policy.maxRegistrationAttempts(), policy.registrationCooldown(), policy.tokenExpiry());
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    /**
     * Register a device or refresh its registration.
     *
     * Checks, in order: blacklist, rate limit, then identity. Only identity
     * conflicts count against {@code originAddress}.
     *
     * @param deviceId      device identity, non-empty
     * @param endpoint      address, port and metadata reported by the device
     * @param originAddress network address the call came from
     * @return success with device snapshot and fresh token, or a denial
     */
    public RegistrationResult registerDevice(String deviceId, EndpointInfo endpoint, String originAddress) {
        RegistrationResult result;
        boolean autoBlacklisted = false;

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            AccessPolicy current = policy;

            if (blacklist.contains(originAddress)) {
                return RegistrationResult.denied(AccessDenialReason.BLACKLISTED,
                        AccessDenialReason.BLACKLISTED.getDescription());
            }

            RegistrationAttemptCounter counter = attempts.get(originAddress);
            if (counter != null
                    && counter.effectiveCount(now, current.registrationCooldown()) >= current.maxRegistrationAttempts()) {
                return RegistrationResult.rateLimited(
                        counter.remainingCooldown(now, current.registrationCooldown()));
            }

            DeviceRecord existing = devices.get(deviceId);
            if (existing == null) {
                DeviceRecord created = addNewDevice(deviceId, endpoint, originAddress, now);
                String token = issueToken(deviceId, now, current);
                result = RegistrationResult.registered(created.snapshot(), token, List.of());
            } else if (existing.getAddress().equals(endpoint.address())) {
                refreshDevice(existing, endpoint, now);
                String token = issueToken(deviceId, now, current);
                result = RegistrationResult.registered(existing.snapshot(), token,
                        List.of(RegistrationResult.SAME_ADDRESS_WARNING));
            } else {
                RegistrationAttemptCounter failures =
                        attempts.computeIfAbsent(originAddress, RegistrationAttemptCounter::new);
                int total = failures.recordFailure(now, current.registrationCooldown());
                if (total >= current.autoBlacklistThreshold()) {
                    autoBlacklisted = blacklist.add(originAddress);
                }
                result = RegistrationResult.denied(AccessDenialReason.IDENTITY_CONFLICT,
                        "Device ID '" + deviceId + "' is already registered from different address ("
                                + existing.getAddress() + ")");
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (autoBlacklisted) {
            log.warn("DEVICE_ACCESS: Address {} blacklisted for excessive registration attempts", originAddress);
        }
        if (result.success()) {
            log.info("DEVICE_ACCESS: Device {} registered from {}{}", deviceId, originAddress,
                    result.warnings().isEmpty() ? "" : " (refresh)");
        } else {
            log.debug("DEVICE_ACCESS: Registration of {} from {} rejected: {}",
                    deviceId, originAddress, result.reason());
        }
        return result;
    }

    private DeviceRecord addNewDevice(String deviceId, EndpointInfo endpoint, String originAddress, Instant now) {
        DeviceRecord record = DeviceRecord.builder()
                .deviceId(deviceId)
                .address(endpoint.address())
                .port(endpoint.port())
                .registeredAt(now)
                .registeredFromAddress(originAddress)
                .lastSeenAt(now)
                .metadata(new LinkedHashMap<>(endpoint.metadata()))
                .status(DeviceStatus.ACTIVE)
                .build();
        devices.put(deviceId, record);
        return record;
    }

    private void refreshDevice(DeviceRecord record, EndpointInfo endpoint, Instant now) {
        record.setAddress(endpoint.address());
        record.setPort(endpoint.port());
        record.mergeMetadata(endpoint.metadata());
        record.setLastSeenAt(now);
        record.setStatus(DeviceStatus.ACTIVE);
    }

    private String issueToken(String deviceId, Instant now, AccessPolicy current) {
        AuthToken previous = tokens.remove(deviceId);
        if (previous != null) {
            tokenOwners.remove(previous.value());
        }

        String value = tokenGenerator.generate(deviceId, now, tokenOwners::containsKey);
        tokens.put(deviceId, new AuthToken(deviceId, value, now, now.plus(current.tokenExpiry())));
        tokenOwners.put(value, deviceId);
        return value;
    }

    // ========================================================================
    // AUTHORIZATION
    // ========================================================================

    /**
     * Whether {@code deviceId} may submit data. Always true with the
     * whitelist disabled.
     */
    public boolean isAuthorized(String deviceId) {
        lock.readLock().lock();
        try {
            return authorized(deviceId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean authorized(String deviceId) {
        if (!policy.enableWhitelist()) {
            return true;
        }
        return devices.containsKey(deviceId);
    }

    /**
     * Check a data submission and count it when accepted.
     *
     * Failed checks never change state. Auth tokens are not consulted here.
     *
     * @param deviceId      identity claimed by the caller
     * @param callerAddress network address the submission came from
     * @return the decision, with a device snapshot on success
     */
    public SubmissionValidation validateSubmission(String deviceId, String callerAddress) {
        lock.writeLock().lock();
        try {
            if (!authorized(deviceId)) {
                return SubmissionValidation.denied(AccessDenialReason.NOT_REGISTERED,
                        "Device '" + deviceId + "' is not registered or authorized");
            }

            DeviceRecord device = devices.get(deviceId);
            if (device == null) {
                // whitelist disabled, nothing to count against
                return SubmissionValidation.allowed(null);
            }

            if (policy.requireUniqueAddresses() && !device.getAddress().equals(callerAddress)) {
                return SubmissionValidation.denied(AccessDenialReason.ADDRESS_MISMATCH,
                        "Data submission from unauthorized address. Expected: " + device.getAddress()
                                + ", Got: " + callerAddress);
            }

            device.recordSubmission(clock.instant());
            return SubmissionValidation.allowed(device.snapshot());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Check a bearer token against the one held for {@code deviceId}.
     * An expired token is dropped on the way.
     */
    public TokenCheck validateAuthToken(String deviceId, String providedToken) {
        lock.writeLock().lock();
        try {
            AuthToken token = tokens.get(deviceId);
            if (token == null) {
                return TokenCheck.invalid("No auth token found");
            }
            if (token.isExpiredAt(clock.instant())) {
                tokens.remove(deviceId);
                tokenOwners.remove(token.value());
                return TokenCheck.invalid("Token expired");
            }
            if (!token.value().equals(providedToken)) {
                return TokenCheck.invalid("Invalid token");
            }
            return TokenCheck.VALID;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // ADMINISTRATION
    // ========================================================================

    /**
     * Remove a device and its token.
     *
     * @return false if the device was not registered
     */
    public boolean unregisterDevice(String deviceId, String reason) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = devices.remove(deviceId) != null;
            AuthToken token = tokens.remove(deviceId);
            if (token != null) {
                tokenOwners.remove(token.value());
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (removed) {
            log.info("DEVICE_ACCESS: Device {} unregistered ({})", deviceId, reason);
        }
        return removed;
    }

    public void blacklistAddress(String address, String reason) {
        lock.writeLock().lock();
        try {
            blacklist.add(address);
        } finally {
            lock.writeLock().unlock();
        }
        log.warn("DEVICE_ACCESS: Address {} blacklisted ({})", address, reason);
    }

    /**
     * @return false if the address was not blacklisted
     */
    public boolean unblacklistAddress(String address) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = blacklist.remove(address);
        } finally {
            lock.writeLock().unlock();
        }

        if (removed) {
            log.info("DEVICE_ACCESS: Address {} removed from blacklist", address);
        }
        return removed;
    }

    public boolean isBlacklisted(String address) {
        lock.readLock().lock();
        try {
            return blacklist.contains(address);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Apply a partial policy change. Existing tokens and counters are not
     * re-evaluated.
     *
     * @return the policy now in effect
     * @throws IllegalArgumentException if the merged policy is invalid; the
     *                                  current policy is kept
     */
    public AccessPolicy updateConfig(AccessPolicyUpdate update) {
        AccessPolicy next;
        lock.writeLock().lock();
        try {
            next = policy.merge(update);
            policy = next;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("DEVICE_ACCESS: Configuration updated: {}", update);
        return next;
    }

    public AccessPolicy policy() {
        lock.readLock().lock();
        try {
            return policy;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public Optional<DeviceRecord> findDevice(String deviceId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(devices.get(deviceId)).map(DeviceRecord::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshots of all registered devices, oldest registration first.
     */
    public List<DeviceRecord> listDevices() {
        lock.readLock().lock();
        try {
            List<DeviceRecord> result = new ArrayList<>(devices.size());
            for (DeviceRecord record : devices.values()) {
                result.add(record.snapshot());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasLiveToken(String deviceId) {
        lock.readLock().lock();
        try {
            return tokens.containsKey(deviceId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public AccessStatsDTO stats() {
        lock.readLock().lock();
        try {
            Instant activeSince = clock.instant().minus(ACTIVE_WINDOW);
            long active = devices.values().stream()
                    .filter(device -> device.getLastSeenAt().isAfter(activeSince))
                    .count();

            return AccessStatsDTO.builder()
                    .totalRegistered(devices.size())
                    .activeDevices(active)
                    .blacklistedAddresses(blacklist.size())
                    .liveTokens(tokens.size())
                    .registrationAttempts(attempts.size())
                    .config(policy)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // SWEEP
    // ========================================================================

    /**
     * Drop expired tokens and attempt counters idle for more than twice the
     * cooldown. Devices and the blacklist are left alone.
     */
    public SweepReport cleanup() {
        int expiredTokens = 0;
        int staleCounters = 0;

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Duration cooldown = policy.registrationCooldown();

            Iterator<AuthToken> tokenIt = tokens.values().iterator();
            while (tokenIt.hasNext()) {
                AuthToken token = tokenIt.next();
                if (token.isExpiredAt(now)) {
                    tokenIt.remove();
                    tokenOwners.remove(token.value());
                    expiredTokens++;
                }
            }

            Iterator<RegistrationAttemptCounter> counterIt = attempts.values().iterator();
            while (counterIt.hasNext()) {
                if (counterIt.next().isStale(now, cooldown)) {
                    counterIt.remove();
                    staleCounters++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (expiredTokens > 0 || staleCounters > 0) {
            log.info("DEVICE_ACCESS: Cleaned up {} expired auth tokens and {} stale attempt counters",
                    expiredTokens, staleCounters);
        }
        return new SweepReport(expiredTokens, staleCounters);
    }

    /**
     * Result of a bearer token check.
     */
    public record TokenCheck(boolean valid, String reason) {

        static final TokenCheck VALID = new TokenCheck(true, null);

        static TokenCheck invalid(String reason) {
            return new TokenCheck(false, reason);
        }
    }

    /**
     * What one sweep removed.
     */
    public record SweepReport(int expiredTokens, int staleCounters) {
    }
}
