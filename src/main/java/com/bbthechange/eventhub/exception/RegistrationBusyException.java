package com.bbthechange.eventhub.exception;

/**
 * Exception thrown when a roster change keeps losing version conflicts and the retry budget runs out.
 * The request made no change and can be retried.
 */
public class RegistrationBusyException extends RuntimeException {

    public RegistrationBusyException(String message) {
        super(message);
    }

    public RegistrationBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
