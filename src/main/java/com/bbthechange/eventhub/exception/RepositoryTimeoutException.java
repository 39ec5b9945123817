package com.bbthechange.eventhub.exception;

/**
 * Exception thrown when a DynamoDB call exceeds its API call timeout.
 * Roster commits are single transactions, so the change was applied entirely or not at all;
 * the request can be retried.
 */
public class RepositoryTimeoutException extends RepositoryException {

    public RepositoryTimeoutException(String message) {
        super(message);
    }

    public RepositoryTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
