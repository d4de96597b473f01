package com.feerouter.error;

/**
 * An external collaborator (AMM gateway, vesting gateway) failed or returned an unusable response.
 * The page aborts with no committed state.
 */
public class IntegrationException extends FeeRouterException {

    public IntegrationException(String message) {
        super(ErrorCodes.INTEGRATION_FAILURE, message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(ErrorCodes.INTEGRATION_FAILURE, message, cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
