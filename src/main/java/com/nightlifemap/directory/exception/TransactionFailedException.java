package com.nightlifemap.directory.exception;

/**
 * Exception thrown when a DynamoDB transaction fails for a reason other than a failed
 * position condition (throttling, transaction conflicts, service errors).
 */
public class TransactionFailedException extends RuntimeException {

    public TransactionFailedException(String message) {
        super(message);
    }

    public TransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
