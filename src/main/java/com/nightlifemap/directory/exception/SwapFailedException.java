package com.nightlifemap.directory.exception;

/**
 * Exception thrown when the sequential swap could not complete but every write it made
 * has been undone. Both venues are back in their original cells.
 */
public class SwapFailedException extends PlacementException {

    public SwapFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public PlacementErrorKind getErrorKind() {
        return PlacementErrorKind.SWAP_FAILED;
    }
}
