package com.medreferral.messaging.auth;

import reactor.core.publisher.Mono;

import javax.annotation.Nullable;

/**
 * Resolves the authenticated user of a request.
 */
public interface IAuthService {

    /**
     * @param token Bearer token, possibly missing
     * @return Mono of the user id, or an {@code AuthenticationException} error
     */
    Mono<String> authenticate(@Nullable String token);
}
