package com.chainfeed.stream;

/**
 * Thrown when a source page cannot be fetched after all retry attempts.
 */
public class TransactionFetchException extends RuntimeException {

    public TransactionFetchException(String message) {
        super(message);
    }

    public TransactionFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
