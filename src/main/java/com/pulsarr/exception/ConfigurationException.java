package com.pulsarr.exception;

/**
 * Exception thrown when rule criteria, condition trees, quotas or seed files are invalid.
 * Raised when a rule is saved; stored rules that fail to parse are skipped during evaluation.
 */
public class ConfigurationException extends RouterException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
