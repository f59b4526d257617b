package com.medreferral.core.error;

/**
 * Rejected input: empty body, oversized body, blank ids or a self-addressed message.
 */
public class ValidationException extends MessagingException {

    public ValidationException(String message) {
        super(message);
    }
}
