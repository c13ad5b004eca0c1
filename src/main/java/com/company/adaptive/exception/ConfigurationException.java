package com.company.adaptive.exception;

/**
 * Invalid threshold, interval or capacity detected at setup.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
