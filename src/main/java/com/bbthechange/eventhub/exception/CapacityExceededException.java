package com.bbthechange.eventhub.exception;

/**
 * Exception thrown when registering for an event whose roster has reached maxAttendees.
 *
 * This is a 409 Conflict error indicating the resource state prevents the operation.
 */
public class CapacityExceededException extends RuntimeException {

    public CapacityExceededException(String message) {
        super(message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
