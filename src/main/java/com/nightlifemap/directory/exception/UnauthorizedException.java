package com.nightlifemap.directory.exception;

/**
 * Exception thrown when the caller may not modify the requested venue.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
