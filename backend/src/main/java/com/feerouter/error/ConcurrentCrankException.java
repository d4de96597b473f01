package com.feerouter.error;

/**
 * Another page for the same vault committed first. Nothing was written; re-read the cursor and retry.
 */
public class ConcurrentCrankException extends FeeRouterException {

    public ConcurrentCrankException(String errorCode, String message) {
        super(errorCode, message);
    }

    public ConcurrentCrankException(String message, Throwable cause) {
        super(ErrorCodes.CONCURRENT_CRANK, message, cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
