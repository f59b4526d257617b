package com.medreferral.core.auth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionTokenTest {

    private static final String SECRET = "test-secret";
    private static final Duration TTL = Duration.ofHours(1);
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("A fresh token resolves to its user")
    void testVerifyValidToken() {
        String token = SessionToken.issue("dr-smith", NOW, SECRET);

        assertEquals(Optional.of("dr-smith"), SessionToken.verify(token, SECRET, TTL, NOW.plusSeconds(60)));
    }

    @Test
    @DisplayName("Tokens signed with another secret are rejected")
    void testWrongSecret() {
        String token = SessionToken.issue("dr-smith", NOW, "other-secret");

        assertTrue(SessionToken.verify(token, SECRET, TTL, NOW).isEmpty());
    }

    @Test
    @DisplayName("Tampering with the user id breaks the signature")
    void testTamperedUser() {
        String token = SessionToken.issue("dr-smith", NOW, SECRET);
        String decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        String forged = Base64.getUrlEncoder().withoutPadding()
            .encodeToString(decoded.replace("dr-smith", "dr-jones").getBytes(StandardCharsets.UTF_8));

        assertTrue(SessionToken.verify(forged, SECRET, TTL, NOW).isEmpty());
    }

    @Test
    @DisplayName("Expired and future-dated tokens are rejected")
    void testAgeWindow() {
        String token = SessionToken.issue("dr-smith", NOW, SECRET);

        assertTrue(SessionToken.verify(token, SECRET, TTL, NOW.plus(TTL).plusSeconds(1)).isEmpty());
        assertTrue(SessionToken.verify(token, SECRET, TTL, NOW.minusSeconds(5)).isEmpty());
        assertTrue(SessionToken.verify(token, SECRET, TTL, NOW.plus(TTL)).isPresent());
    }

    @Test
    @DisplayName("Garbage input is rejected without throwing")
    void testMalformed() {
        assertTrue(SessionToken.verify("%%%not-base64", SECRET, TTL, NOW).isEmpty());
        assertTrue(SessionToken.verify("", SECRET, TTL, NOW).isEmpty());
        assertTrue(SessionToken.verify(null, SECRET, TTL, NOW).isEmpty());
        String twoParts = Base64.getUrlEncoder().encodeToString("a:b".getBytes(StandardCharsets.UTF_8));
        assertTrue(SessionToken.verify(twoParts, SECRET, TTL, NOW).isEmpty());
    }

    @Test
    void testIssueRejectsDelimiterInUserId() {
        assertThrows(IllegalArgumentException.class, () -> SessionToken.issue("a:b", NOW, SECRET));
        assertThrows(IllegalArgumentException.class, () -> SessionToken.issue(" ", NOW, SECRET));
    }
}
