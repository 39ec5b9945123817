package com.bbthechange.eventhub.exception;

/**
 * Exception thrown when an event's status does not accept registrations
 * (anything other than PUBLISHED).
 */
public class EventNotAvailableException extends RuntimeException {

    public EventNotAvailableException(String message) {
        super(message);
    }

    public EventNotAvailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
