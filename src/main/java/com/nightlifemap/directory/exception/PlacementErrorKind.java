package com.nightlifemap.directory.exception;

/**
 * Error taxonomy of the placement operation.
 * Client errors are safe to retry once the input is fixed; SWAP_FAILED and FATAL are
 * server-side and callers should inspect state before trying again.
 */
public enum PlacementErrorKind {
    INVALID_INPUT(true),
    OUT_OF_BOUNDS(true),
    NOT_FOUND(false),
    CONFLICT(true),
    SWAP_FAILED(true),
    FATAL(false);

    private final boolean retryable;

    PlacementErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
