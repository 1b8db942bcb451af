package com.nightlifemap.directory.exception;

/**
 * Exception thrown when a table key cannot be built from the supplied identifiers.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
