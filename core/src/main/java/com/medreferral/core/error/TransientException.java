package com.medreferral.core.error;

/**
 * Network, storage or feed disconnect. Safe to retry, but never retried implicitly on writes.
 */
public class TransientException extends MessagingException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
