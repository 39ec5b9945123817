package com.bbthechange.eventhub.exception;

/**
 * Exception thrown when a user tries to register for an event they are already on the roster of.
 *
 * Clients can treat this as a no-op success; it is reported separately so duplicates stay visible.
 */
public class AlreadyRegisteredException extends RuntimeException {

    public AlreadyRegisteredException(String message) {
        super(message);
    }

    public AlreadyRegisteredException(String message, Throwable cause) {
        super(message, cause);
    }
}
