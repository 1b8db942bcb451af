package com.nightlifemap.directory.exception;

/**
 * Exception thrown when a conditional position write finds the venue no longer where it was read,
 * or the atomic exchange reports a failed position condition.
 * Callers should refresh their view of the grid and retry.
 */
public class PlacementConflictException extends PlacementException {

    public PlacementConflictException(String message) {
        super(message);
    }

    public PlacementConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public PlacementErrorKind getErrorKind() {
        return PlacementErrorKind.CONFLICT;
    }
}
