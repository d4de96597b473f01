package com.feerouter.error;

/**
 * Quote-only guard failure or non-designated-asset fees on claim. Fatal for the call: a stalled crank is preferable to wrong fee accounting.
 */
public class SafetyViolationException extends FeeRouterException {

    public SafetyViolationException(String errorCode, String message) {
        super(errorCode, message);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
