package com.pulsarr.exception;

/**
 * Exception thrown when quota, approval or rule storage cannot be read or written.
 * Always propagated so the caller can retry the whole event.
 */
public class PersistenceException extends RouterException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
