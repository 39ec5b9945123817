package com.bbthechange.eventhub.exception;

/**
 * Exception thrown when a request has no authenticated user.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
