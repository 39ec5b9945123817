package com.bbthechange.eventhub.exception;

/**
 * Exception thrown when an optimistic locking version conflict occurs.
 *
 * This indicates that the event roster has been modified by another request
 * since it was last read.
 *
 * Note: RegistrationServiceImpl handles version conflicts internally with automatic retries.
 * This exception should not reach external callers.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
