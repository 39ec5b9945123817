package com.bbthechange.eventhub.exception;

/**
 * Exception thrown when a user tries to unregister from an event they are not on the roster of.
 */
public class NotRegisteredException extends RuntimeException {

    public NotRegisteredException(String message) {
        super(message);
    }

    public NotRegisteredException(String message, Throwable cause) {
        super(message, cause);
    }
}
