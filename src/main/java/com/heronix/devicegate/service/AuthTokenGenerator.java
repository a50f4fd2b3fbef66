package com.heronix.devicegate.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.function.Predicate;

import com.heronix.devicegate.exception.TokenGenerationException;

/**
 * Generates opaque auth token values.
 *
 * Token format: lowercase hex SHA-256 of {@code deviceId-issuedAtMillis-nonce},
 * where nonce is 16 random bytes in hex. 64 characters.
 */
public class AuthTokenGenerator {

    // Maximum attempts to generate a unique token before failing
    private static final int MAX_GENERATION_ATTEMPTS = 100;

    private static final int NONCE_BYTES = 16;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Generate a token value that {@code inUse} does not already know.
     *
     * @param deviceId owning device
     * @param issuedAt issue time mixed into the digest
     * @param inUse    collision check against live tokens
     * @return a fresh token value
     */
    public String generate(String deviceId, Instant issuedAt, Predicate<String> inUse) {
        for (int attempt = 0; attempt < MAX_GENERATION_ATTEMPTS; attempt++) {
            String candidate = digest(deviceId + "-" + issuedAt.toEpochMilli() + "-" + nonce());
            if (!inUse.test(candidate)) {
                return candidate;
            }
        }

        throw new TokenGenerationException(
                "Failed to generate unique token after " + MAX_GENERATION_ATTEMPTS + " attempts");
    }

    private String nonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String digest(String input) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new TokenGenerationException("SHA-256 not available", e);
        }
    }
}
