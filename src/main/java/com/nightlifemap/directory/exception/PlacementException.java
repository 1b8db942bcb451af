package com.nightlifemap.directory.exception;

/**
 * Base class for failures of a placement request that are reported to the caller by kind.
 */
public abstract class PlacementException extends RuntimeException {

    protected PlacementException(String message) {
        super(message);
    }

    protected PlacementException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract PlacementErrorKind getErrorKind();

    public boolean isRetryable() {
        return getErrorKind().isRetryable();
    }
}
