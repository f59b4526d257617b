package com.medreferral.core.error;

/**
 * Base class for all messaging failures surfaced to callers.
 */
public abstract class MessagingException extends RuntimeException {

    protected MessagingException(String message) {
        super(message);
    }

    protected MessagingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may retry the same operation. Only transport and storage hiccups qualify.
     */
    public boolean isRetryable() {
        return false;
    }
}
