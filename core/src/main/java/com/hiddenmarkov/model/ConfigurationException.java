package com.hiddenmarkov.model;

/**
 * Thrown when model tables violate a structural or probabilistic invariant.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
