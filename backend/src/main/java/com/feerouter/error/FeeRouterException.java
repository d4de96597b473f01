package com.feerouter.error;

import lombok.Getter;

/**
 * Root of the fee router's rejection taxonomy. Every rejection aborts the whole operation with no committed
 * state; the API layer maps the concrete subclass to an HTTP status and {@link #getErrorCode()} to the body.
 */
@Getter
public abstract class FeeRouterException extends RuntimeException {

    /** Stable machine-readable code, see {@link ErrorCodes}. */
    private final String errorCode;

    protected FeeRouterException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FeeRouterException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /** Whether the identical call may succeed later without any change by the caller other than timing or cursor. */
    public abstract boolean isRetriable();
}
