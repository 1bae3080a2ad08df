package com.pulsarr.exception;

/**
 * Exception thrown when a write references a user, rule or instance that does not exist.
 */
public class ReferentialIntegrityException extends PersistenceException {

    public ReferentialIntegrityException(String message) {
        super(message);
    }

    public ReferentialIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
