package com.feerouter.error;

/**
 * Page rejected by admission (replay, skip, overlap, bad size, investor set mismatch). Retry with pageStart read from the current cursor.
 */
public class SequenceViolationException extends FeeRouterException {

    public SequenceViolationException(String errorCode, String message) {
        super(errorCode, message);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
