package com.feerouter.error;

/**
 * Bad policy parameters, duplicate setup, or a roster change while a day is in progress. Fix the input; never retriable as-is.
 */
public class ConfigurationException extends FeeRouterException {

    public ConfigurationException(String errorCode, String message) {
        super(errorCode, message);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
