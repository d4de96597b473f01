package com.feerouter.error;

/**
 * First page of a day attempted before 24 hours have passed since the last distribution. Wait and retry.
 */
public class WindowViolationException extends FeeRouterException {

    public WindowViolationException(String errorCode, String message) {
        super(errorCode, message);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
