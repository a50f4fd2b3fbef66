package com.heronix.devicegate.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.devicegate.model.domain.AccessPolicy;
import com.heronix.devicegate.model.domain.AccessPolicyUpdate;
import com.heronix.devicegate.model.domain.DeviceRecord;
import com.heronix.devicegate.model.domain.EndpointInfo;
import com.heronix.devicegate.model.domain.RegistrationResult;
import com.heronix.devicegate.model.domain.SubmissionValidation;
import com.heronix.devicegate.model.dto.AccessStatsDTO;
import com.heronix.devicegate.model.enums.AccessDenialReason;
import com.heronix.devicegate.model.enums.DeviceStatus;
import com.heronix.devicegate.support.MutableClock;

/**
 * Registration, whitelist and sweep behaviour of the access manager, driven
 * by a hand-advanced clock.
 */
class DeviceAccessManagerTest {

    private static final String HOME = "10.0.0.5";
    private static final String INTRUDER = "10.0.0.9";

    private MutableClock clock;
    private DeviceAccessManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        manager = new DeviceAccessManager(AccessPolicy.defaults(), clock);
    }

    // ========================================================================
    // REGISTRATION
    // ========================================================================

    @Test
    void newDeviceIsRegisteredWithToken() {
        RegistrationResult result = manager.registerDevice("sensor-1",
                EndpointInfo.of(HOME, 8080, Map.of("type", "sensor")), HOME);

        assertTrue(result.success());
        assertNull(result.reason());
        assertTrue(result.warnings().isEmpty());
        assertTrue(result.authToken().matches("[0-9a-f]{64}"));

        DeviceRecord device = result.device();
        assertEquals("sensor-1", device.getDeviceId());
        assertEquals(HOME, device.getAddress());
        assertEquals(8080, device.getPort());
        assertEquals(HOME, device.getRegisteredFromAddress());
        assertEquals(clock.instant(), device.getRegisteredAt());
        assertEquals(clock.instant(), device.getLastSeenAt());
        assertEquals(DeviceStatus.ACTIVE, device.getStatus());
        assertEquals(0, device.getSubmissionCount());
        assertNull(device.getLastSubmissionAt());
        assertEquals("sensor", device.getMetadata().get("type"));

        assertTrue(manager.hasLiveToken("sensor-1"));
        assertTrue(manager.isAuthorized("sensor-1"));
    }

    @Test
    void portDefaultsTo80() {
        RegistrationResult result = manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);

        assertEquals(80, result.device().getPort());
        assertTrue(result.device().getMetadata().isEmpty());
    }

    @Test
    void deviceIdsAreCaseSensitive() {
        manager.registerDevice("Sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        RegistrationResult other = manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);

        assertTrue(other.success());
        assertEquals(2, manager.listDevices().size());
    }

    @Test
    void sameAddressRegistrationRefreshesAndMergesMetadata() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("type", "sensor");
        first.put("location", "kitchen");
        RegistrationResult initial = manager.registerDevice("sensor-1", EndpointInfo.of(HOME, 80, first), HOME);

        clock.advance(Duration.ofMinutes(1));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("location", "garage");
        second.put("firmware", "1.1.0");
        RegistrationResult refresh = manager.registerDevice("sensor-1",
                EndpointInfo.of(HOME, 8081, second), "10.0.0.77");

        assertTrue(refresh.success());
        assertEquals(List.of(RegistrationResult.SAME_ADDRESS_WARNING), refresh.warnings());
        assertNotEquals(initial.authToken(), refresh.authToken());

        DeviceRecord device = refresh.device();
        assertEquals(8081, device.getPort());
        assertEquals(Map.of("type", "sensor", "location", "garage", "firmware", "1.1.0"), device.getMetadata());
        assertEquals(HOME, device.getRegisteredFromAddress());
        assertEquals(initial.device().getRegisteredAt(), device.getRegisteredAt());
        assertEquals(clock.instant(), device.getLastSeenAt());
        assertEquals(1, manager.listDevices().size());
        assertEquals(0, manager.stats().getRegistrationAttempts());
    }

    @Test
    void differentAddressIsAnIdentityConflict() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);

        RegistrationResult conflict = manager.registerDevice("sensor-1",
                EndpointInfo.of(INTRUDER, null, null), INTRUDER);

        assertFalse(conflict.success());
        assertEquals(AccessDenialReason.IDENTITY_CONFLICT, conflict.reason());
        assertTrue(conflict.message().contains(HOME));
        assertNull(conflict.authToken());
        assertNull(conflict.retryAfter());

        assertEquals(HOME, manager.findDevice("sensor-1").orElseThrow().getAddress());
        assertEquals(1, manager.stats().getRegistrationAttempts());
    }

    @Test
    void conflictsBeyondLimitAreRateLimitedUntilCooldownPasses() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);

        for (int i = 0; i < 5; i++) {
            RegistrationResult conflict = manager.registerDevice("sensor-1",
                    EndpointInfo.of(INTRUDER, null, null), INTRUDER);
            assertEquals(AccessDenialReason.IDENTITY_CONFLICT, conflict.reason(), "attempt " + (i + 1));
        }

        clock.advance(Duration.ofMinutes(2));
        RegistrationResult limited = manager.registerDevice("other-device",
                EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        assertEquals(AccessDenialReason.RATE_LIMITED, limited.reason());
        assertEquals(Duration.ofMinutes(3), limited.retryAfter());
        assertEquals(Long.valueOf(180), limited.retryAfterSeconds());
        assertTrue(manager.findDevice("other-device").isEmpty());

        clock.advance(Duration.ofMinutes(3).plusSeconds(1));
        RegistrationResult fresh = manager.registerDevice("other-device",
                EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        assertTrue(fresh.success());
    }

    @Test
    void rateLimitedAttemptsAreNotCounted() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        for (int i = 0; i < 5; i++) {
            manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        }

        for (int i = 0; i < 20; i++) {
            assertEquals(AccessDenialReason.RATE_LIMITED, manager.registerDevice("sensor-1",
                    EndpointInfo.of(INTRUDER, null, null), INTRUDER).reason());
        }

        assertFalse(manager.isBlacklisted(INTRUDER));
    }

    @Test
    void retryAfterIsAtLeastOneSecondAtWindowBoundary() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        for (int i = 0; i < 5; i++) {
            manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        }

        clock.advance(Duration.ofMinutes(5));
        RegistrationResult limited = manager.registerDevice("other-device",
                EndpointInfo.of(INTRUDER, null, null), INTRUDER);

        assertEquals(AccessDenialReason.RATE_LIMITED, limited.reason());
        assertEquals(Duration.ZERO, limited.retryAfter());
        assertEquals(Long.valueOf(1), limited.retryAfterSeconds());
    }

    @Test
    void twiceTheLimitOfConflictsBlacklistsTheAddress() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);

        for (int i = 0; i < 5; i++) {
            manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        }
        assertFalse(manager.isBlacklisted(INTRUDER));

        // window resets, cumulative failures do not
        clock.advance(Duration.ofMinutes(6));
        for (int i = 0; i < 4; i++) {
            assertEquals(AccessDenialReason.IDENTITY_CONFLICT, manager.registerDevice("sensor-1",
                    EndpointInfo.of(INTRUDER, null, null), INTRUDER).reason());
        }
        assertFalse(manager.isBlacklisted(INTRUDER), "9 failures must not blacklist");

        manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        assertTrue(manager.isBlacklisted(INTRUDER), "10 failures must blacklist");

        clock.advance(Duration.ofHours(1));
        RegistrationResult blocked = manager.registerDevice("brand-new",
                EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        assertEquals(AccessDenialReason.BLACKLISTED, blocked.reason());
        assertEquals(1, manager.stats().getBlacklistedAddresses());
    }

    @Test
    void blacklistIsCheckedFirstAndMutatesNothing() {
        manager.blacklistAddress(INTRUDER, "test");

        RegistrationResult result = manager.registerDevice("sensor-1",
                EndpointInfo.of(INTRUDER, null, null), INTRUDER);

        assertEquals(AccessDenialReason.BLACKLISTED, result.reason());
        AccessStatsDTO stats = manager.stats();
        assertEquals(0, stats.getTotalRegistered());
        assertEquals(0, stats.getLiveTokens());
        assertEquals(0, stats.getRegistrationAttempts());

        assertTrue(manager.unblacklistAddress(INTRUDER));
        assertFalse(manager.unblacklistAddress(INTRUDER));
        assertTrue(manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER).success());
    }

    // ========================================================================
    // AUTHORIZATION & SUBMISSIONS
    // ========================================================================

    @Test
    void disabledWhitelistAuthorizesEveryone() {
        manager.updateConfig(AccessPolicyUpdate.builder().enableWhitelist(false).build());

        assertTrue(manager.isAuthorized("never-registered"));
        SubmissionValidation validation = manager.validateSubmission("never-registered", HOME);
        assertTrue(validation.allowed());
        assertNull(validation.device());

        manager.updateConfig(AccessPolicyUpdate.builder().enableWhitelist(true).build());
        assertFalse(manager.isAuthorized("never-registered"));
    }

    @Test
    void unregisteredDeviceCannotSubmit() {
        SubmissionValidation validation = manager.validateSubmission("ghost", HOME);

        assertFalse(validation.allowed());
        assertEquals(AccessDenialReason.NOT_REGISTERED, validation.reason());
        assertTrue(validation.message().contains("ghost"));
    }

    @Test
    void acceptedSubmissionsAreCountedExactlyOnce() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);

        for (int i = 1; i <= 3; i++) {
            clock.advance(Duration.ofSeconds(10));
            SubmissionValidation validation = manager.validateSubmission("sensor-1", INTRUDER);
            assertTrue(validation.allowed());
            assertEquals(i, validation.device().getSubmissionCount());
            assertEquals(clock.instant(), validation.device().getLastSubmissionAt());
            assertEquals(clock.instant(), validation.device().getLastSeenAt());
        }

        manager.validateSubmission("unknown", HOME);
        assertEquals(3, manager.findDevice("sensor-1").orElseThrow().getSubmissionCount());
    }

    @Test
    void strictAddressModeRejectsOtherCallersWithoutCounting() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        manager.updateConfig(AccessPolicyUpdate.builder().requireUniqueAddresses(true).build());

        SubmissionValidation mismatch = manager.validateSubmission("sensor-1", INTRUDER);
        assertFalse(mismatch.allowed());
        assertEquals(AccessDenialReason.ADDRESS_MISMATCH, mismatch.reason());
        assertTrue(mismatch.message().contains(HOME));
        assertTrue(mismatch.message().contains(INTRUDER));
        assertEquals(0, manager.findDevice("sensor-1").orElseThrow().getSubmissionCount());

        assertTrue(manager.validateSubmission("sensor-1", HOME).allowed());
        assertEquals(1, manager.findDevice("sensor-1").orElseThrow().getSubmissionCount());
    }

    @Test
    void snapshotsAreDetachedFromRegistry() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, Map.of("type", "sensor")), HOME);

        DeviceRecord snapshot = manager.findDevice("sensor-1").orElseThrow();
        snapshot.setAddress("1.2.3.4");
        snapshot.getMetadata().put("type", "hacked");

        DeviceRecord stored = manager.findDevice("sensor-1").orElseThrow();
        assertEquals(HOME, stored.getAddress());
        assertEquals("sensor", stored.getMetadata().get("type"));
    }

    // ========================================================================
    // TOKENS
    // ========================================================================

    @Test
    void reRegistrationSupersedesPreviousToken() {
        String first = manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME).authToken();
        String second = manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME).authToken();

        assertEquals("Invalid token", manager.validateAuthToken("sensor-1", first).reason());
        assertTrue(manager.validateAuthToken("sensor-1", second).valid());
        assertEquals(1, manager.stats().getLiveTokens());
    }

    @Test
    void expiredTokenIsDroppedOnCheck() {
        String token = manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME).authToken();

        clock.advance(Duration.ofHours(24).plusSeconds(1));

        DeviceAccessManager.TokenCheck check = manager.validateAuthToken("sensor-1", token);
        assertFalse(check.valid());
        assertEquals("Token expired", check.reason());
        assertFalse(manager.hasLiveToken("sensor-1"));
        assertEquals("No auth token found", manager.validateAuthToken("sensor-1", token).reason());
    }

    @Test
    void submissionsDoNotDependOnTokens() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        clock.advance(Duration.ofDays(2));
        manager.cleanup();

        assertFalse(manager.hasLiveToken("sensor-1"));
        assertTrue(manager.validateSubmission("sensor-1", HOME).allowed());
    }

    @Test
    void tokensAreUniqueAcrossDevices() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(manager.registerDevice("device-" + i, EndpointInfo.of("10.1.0." + (i % 250), null, null), HOME)
                    .authToken());
        }
        assertEquals(200, seen.size());
    }

    // ========================================================================
    // ADMINISTRATION
    // ========================================================================

    @Test
    void unregisterRemovesDeviceAndTokenOnly() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        manager.blacklistAddress("10.9.9.9", "test");

        assertTrue(manager.unregisterDevice("sensor-1", "decommissioned"));
        assertFalse(manager.unregisterDevice("sensor-1", "again"));

        AccessStatsDTO stats = manager.stats();
        assertEquals(0, stats.getTotalRegistered());
        assertEquals(0, stats.getLiveTokens());
        assertEquals(1, stats.getRegistrationAttempts());
        assertEquals(1, stats.getBlacklistedAddresses());
        assertFalse(manager.isAuthorized("sensor-1"));
    }

    @Test
    void configUpdateAppliesToSubsequentCalls() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        AccessPolicy updated = manager.updateConfig(AccessPolicyUpdate.builder().maxRegistrationAttempts(2).build());

        assertEquals(2, updated.maxRegistrationAttempts());
        assertEquals(AccessPolicy.DEFAULT_REGISTRATION_COOLDOWN, updated.registrationCooldown());
        assertEquals(updated, manager.stats().getConfig());

        manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        assertEquals(AccessDenialReason.RATE_LIMITED, manager.registerDevice("sensor-1",
                EndpointInfo.of(INTRUDER, null, null), INTRUDER).reason());
    }

    @Test
    void invalidConfigUpdateKeepsCurrentPolicy() {
        AccessPolicy before = manager.policy();

        assertThrows(IllegalArgumentException.class,
                () -> manager.updateConfig(AccessPolicyUpdate.builder().maxRegistrationAttempts(0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> manager.updateConfig(AccessPolicyUpdate.builder().tokenExpiry(Duration.ZERO).build()));

        assertEquals(before, manager.policy());
    }

    @Test
    void tokenExpiryChangeIsNotRetroactive() {
        String token = manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME).authToken();
        manager.updateConfig(AccessPolicyUpdate.builder().tokenExpiry(Duration.ofMinutes(1)).build());

        clock.advance(Duration.ofMinutes(10));
        assertTrue(manager.validateAuthToken("sensor-1", token).valid());
    }

    @Test
    void statsCountOnlyRecentlySeenDevicesAsActive() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        manager.registerDevice("sensor-2", EndpointInfo.of("10.0.0.6", null, null), "10.0.0.6");

        clock.advance(Duration.ofMinutes(6));
        manager.validateSubmission("sensor-2", "10.0.0.6");

        AccessStatsDTO stats = manager.stats();
        assertEquals(2, stats.getTotalRegistered());
        assertEquals(1, stats.getActiveDevices());
        assertEquals(2, stats.getLiveTokens());
        assertEquals(AccessPolicy.defaults(), stats.getConfig());
    }

    // ========================================================================
    // SWEEP
    // ========================================================================

    @Test
    void cleanupOnEmptyStateIsNoOp() {
        DeviceAccessManager.SweepReport report = assertDoesNotThrow(() -> manager.cleanup());

        assertEquals(0, report.expiredTokens());
        assertEquals(0, report.staleCounters());
    }

    @Test
    void cleanupDropsExpiredTokensButKeepsDevices() {
        manager.registerDevice("old", EndpointInfo.of(HOME, null, null), HOME);
        clock.advance(Duration.ofHours(12));
        manager.registerDevice("young", EndpointInfo.of("10.0.0.6", null, null), "10.0.0.6");
        clock.advance(Duration.ofHours(12).plusSeconds(1));

        DeviceAccessManager.SweepReport report = manager.cleanup();

        assertEquals(1, report.expiredTokens());
        assertFalse(manager.hasLiveToken("old"));
        assertTrue(manager.hasLiveToken("young"));
        assertEquals(2, manager.stats().getTotalRegistered());
    }

    @Test
    void cleanupPrunesCountersIdleForTwiceTheCooldown() {
        manager.registerDevice("sensor-1", EndpointInfo.of(HOME, null, null), HOME);
        manager.registerDevice("sensor-1", EndpointInfo.of(INTRUDER, null, null), INTRUDER);
        manager.blacklistAddress("10.9.9.9", "test");

        clock.advance(Duration.ofMinutes(10));
        assertEquals(0, manager.cleanup().staleCounters());
        assertEquals(1, manager.stats().getRegistrationAttempts());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, manager.cleanup().staleCounters());
        assertEquals(0, manager.stats().getRegistrationAttempts());
        assertTrue(manager.isBlacklisted("10.9.9.9"));
    }

    // ========================================================================
    // CONCURRENCY
    // ========================================================================

    @Test
    void concurrentRegistrationsOfOneIdentityProduceOneRecord() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RegistrationResult>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < callers; i++) {
                String address = "10.2.0." + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return manager.registerDevice("contested", EndpointInfo.of(address, null, null), address);
                }));
            }
            start.countDown();

            int successes = 0;
            int conflicts = 0;
            for (Future<RegistrationResult> future : futures) {
                RegistrationResult result = future.get(10, TimeUnit.SECONDS);
                if (result.success()) {
                    successes++;
                } else if (result.reason() == AccessDenialReason.IDENTITY_CONFLICT) {
                    conflicts++;
                }
            }

            assertEquals(1, successes);
            assertEquals(callers - 1, conflicts);
            assertEquals(1, manager.listDevices().size());
            assertEquals(1, manager.stats().getLiveTokens());
        } finally {
            pool.shutdownNow();
        }
    }
}
