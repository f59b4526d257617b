package com.medreferral.core.error;

/**
 * No valid session: the token is missing, malformed, badly signed or expired.
 */
public class AuthenticationException extends MessagingException {

    public AuthenticationException(String message) {
        super(message);
    }
}
