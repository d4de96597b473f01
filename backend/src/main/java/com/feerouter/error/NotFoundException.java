package com.feerouter.error;

/**
 * Vault has no policy, position or roster.
 */
public class NotFoundException extends FeeRouterException {

    public NotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
