package com.medreferral.messaging.auth;

import com.medreferral.core.auth.SessionToken;
import com.medreferral.core.error.AuthenticationException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

class TokenAuthServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final TokenAuthService authService =
        new TokenAuthService("secret", Duration.ofMinutes(30), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void testIssuedTokenAuthenticates() {
        StepVerifier.create(authService.authenticate(authService.issue("dr-lee")))
            .expectNext("dr-lee")
            .verifyComplete();
    }

    @Test
    void testMissingTokenRejected() {
        StepVerifier.create(authService.authenticate(null))
            .expectError(AuthenticationException.class)
            .verify();
        StepVerifier.create(authService.authenticate("  "))
            .expectError(AuthenticationException.class)
            .verify();
    }

    @Test
    void testExpiredTokenRejected() {
        String old = SessionToken.issue("dr-lee", NOW.minus(Duration.ofHours(1)), "secret");

        StepVerifier.create(authService.authenticate(old))
            .expectError(AuthenticationException.class)
            .verify();
    }

    @Test
    void testForeignSecretRejected() {
        String forged = SessionToken.issue("dr-lee", NOW, "another-secret");

        StepVerifier.create(authService.authenticate(forged))
            .expectError(AuthenticationException.class)
            .verify();
    }
}
