package com.medreferral.core.error;

/**
 * Wire code and HTTP status for each failure class.
 */
public enum ErrorCode {
    VALIDATION("validation", 400),
    UNAUTHENTICATED("unauthenticated", 401),
    FORBIDDEN("forbidden", 403),
    UNAVAILABLE("unavailable", 503),
    INTERNAL("internal", 500);

    private final String code;
    private final int httpStatus;

    ErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public static ErrorCode of(Throwable error) {
        if (error instanceof ValidationException) {
            return VALIDATION;
        }
        if (error instanceof AuthenticationException) {
            return UNAUTHENTICATED;
        }
        if (error instanceof AuthorizationException) {
            return FORBIDDEN;
        }
        if (error instanceof TransientException) {
            return UNAVAILABLE;
        }
        return INTERNAL;
    }
}
