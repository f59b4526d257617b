package com.medreferral.core.error;

/**
 * The authenticated user is not allowed to touch the target rows.
 */
public class AuthorizationException extends MessagingException {

    public AuthorizationException(String message) {
        super(message);
    }
}
