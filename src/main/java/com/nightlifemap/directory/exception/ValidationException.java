package com.nightlifemap.directory.exception;

/**
 * Exception thrown for missing or malformed request input. Raised before any store access.
 */
public class ValidationException extends PlacementException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public PlacementErrorKind getErrorKind() {
        return PlacementErrorKind.INVALID_INPUT;
    }
}
