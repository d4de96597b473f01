package com.feerouter.error;

/**
 * Error codes returned in {@code ErrorBody.error}.
 */
public final class ErrorCodes {

    public static final String INVALID_POLICY_PARAMETERS = "INVALID_POLICY_PARAMETERS";
    public static final String POLICY_ALREADY_EXISTS = "POLICY_ALREADY_EXISTS";
    public static final String POSITION_ALREADY_EXISTS = "POSITION_ALREADY_EXISTS";
    public static final String ROSTER_LOCKED = "ROSTER_LOCKED";
    public static final String INVALID_ROSTER = "INVALID_ROSTER";

    public static final String QUOTE_ONLY_VALIDATION_FAILED = "QUOTE_ONLY_VALIDATION_FAILED";
    public static final String INVALID_POOL_CONFIGURATION = "INVALID_POOL_CONFIGURATION";
    public static final String BASE_FEES_DETECTED = "BASE_FEES_DETECTED";

    public static final String INVALID_PAGINATION = "INVALID_PAGINATION";
    public static final String INVALID_PAGINATION_SEQUENCE = "INVALID_PAGINATION_SEQUENCE";
    public static final String INVESTOR_SET_MISMATCH = "INVESTOR_SET_MISMATCH";

    public static final String DISTRIBUTION_WINDOW_NOT_ELAPSED = "DISTRIBUTION_WINDOW_NOT_ELAPSED";

    public static final String POLICY_NOT_FOUND = "POLICY_NOT_FOUND";
    public static final String POSITION_NOT_FOUND = "POSITION_NOT_FOUND";
    public static final String ROSTER_NOT_FOUND = "ROSTER_NOT_FOUND";

    public static final String CONCURRENT_CRANK = "CONCURRENT_CRANK";
    public static final String MATH_OVERFLOW = "MATH_OVERFLOW";
    public static final String INTEGRATION_FAILURE = "INTEGRATION_FAILURE";

    private ErrorCodes() {
    }
}
