package com.medreferral.messaging.auth;

import com.medreferral.core.auth.SessionToken;
import com.medreferral.core.error.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;

/**
 * Verifies HMAC-signed session tokens issued by the portal's login service.
 */
public class TokenAuthService implements IAuthService {
    private static final Logger log = LoggerFactory.getLogger(TokenAuthService.class);

    private final String secret;
    private final Duration ttl;
    private final Clock clock;

    public TokenAuthService(String secret, Duration ttl) {
        this(secret, ttl, Clock.systemUTC());
    }

    public TokenAuthService(String secret, Duration ttl, Clock clock) {
        this.secret = secret;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Mono<String> authenticate(@Nullable String token) {
        return Mono.defer(() -> {
            if (token == null || token.isBlank()) {
                return Mono.error(new AuthenticationException("Missing session token"));
            }
            return SessionToken.verify(token, secret, ttl, clock.instant())
                .map(Mono::just)
                .orElseGet(() -> {
                    log.debug("Rejected session token");
                    return Mono.error(new AuthenticationException("Invalid or expired session token"));
                });
        });
    }

    /**
     * Issues a token for {@code userId} valid from now. Used by tooling and tests.
     */
    public String issue(String userId) {
        return SessionToken.issue(userId, clock.instant(), secret);
    }
}
