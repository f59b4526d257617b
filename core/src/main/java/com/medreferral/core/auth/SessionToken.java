package com.medreferral.core.auth;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Signed session tokens identifying the authenticated user.
 * <p>
 * <b>Token format:</b> {@code base64url(userId:issuedAt:hmac)}
 * <ul>
 *   <li>{@code userId}: opaque user identifier (must not contain {@code ':'})</li>
 *   <li>{@code issuedAt}: issue time in epoch seconds</li>
 *   <li>{@code hmac}: HMAC-SHA256 over "userId:issuedAt", hex encoded</li>
 * </ul>
 * </p>
 */
public final class SessionToken {
    private static final String DELIMITER = ":";

    private SessionToken() {
    }

    public static String issue(String userId, Instant issuedAt, String secret) {
        if (userId == null || userId.isBlank() || userId.contains(DELIMITER)) {
            throw new IllegalArgumentException("Invalid user id for token: " + userId);
        }
        String payload = userId + DELIMITER + issuedAt.getEpochSecond();
        String token = payload + DELIMITER + sign(payload, secret);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Verifies signature and age.
     *
     * @return the user id, or empty if the token is malformed, forged, issued in the future or older than {@code ttl}
     */
    public static Optional<String> verify(String token, String secret, Duration ttl, Instant now) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        String[] parts = decoded.split(DELIMITER);
        if (parts.length != 3) {
            return Optional.empty();
        }

        long issuedAt;
        try {
            issuedAt = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }

        String payload = parts[0] + DELIMITER + parts[1];
        if (!sign(payload, secret).equals(parts[2])) {
            return Optional.empty();
        }

        long age = now.getEpochSecond() - issuedAt;
        if (age < 0 || age > ttl.getSeconds()) {
            return Optional.empty();
        }
        return Optional.of(parts[0]);
    }

    private static String sign(String payload, String secret) {
        return Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8))
            .hashString(payload, StandardCharsets.UTF_8)
            .toString();
    }
}
