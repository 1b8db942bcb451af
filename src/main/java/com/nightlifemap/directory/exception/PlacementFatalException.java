package com.nightlifemap.directory.exception;

import com.nightlifemap.directory.model.GridCell;

/**
 * Exception thrown when a swap rollback itself failed.
 *
 * The source venue may be left without a position and needs an operator to put it back
 * in {@link #getOriginalCell()}. Never retried automatically.
 */
public class PlacementFatalException extends PlacementException {

    private final String detachedVenueId;
    private final GridCell originalCell;

    public PlacementFatalException(String message, String detachedVenueId, GridCell originalCell, Throwable cause) {
        super(message, cause);
        this.detachedVenueId = detachedVenueId;
        this.originalCell = originalCell;
    }

    @Override
    public PlacementErrorKind getErrorKind() {
        return PlacementErrorKind.FATAL;
    }

    public String getDetachedVenueId() {
        return detachedVenueId;
    }

    public GridCell getOriginalCell() {
        return originalCell;
    }
}
