package com.nightlifemap.directory.exception;

/**
 * Exception thrown when the requested cell does not exist in the zone's layout.
 *
 * Carries the valid ranges when the zone is known so the client can correct the request.
 */
public class OutOfBoundsException extends PlacementException {

    private final String zone;
    private final int row;
    private final int col;
    private final int[] validRows;
    private final int[] validCols;

    public OutOfBoundsException(String message, String zone, int row, int col, int[] validRows, int[] validCols) {
        super(message);
        this.zone = zone;
        this.row = row;
        this.col = col;
        this.validRows = validRows;
        this.validCols = validCols;
    }

    @Override
    public PlacementErrorKind getErrorKind() {
        return PlacementErrorKind.OUT_OF_BOUNDS;
    }

    public String getZone() {
        return zone;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * @return {min, max} valid rows, or null for an unknown zone
     */
    public int[] getValidRows() {
        return validRows;
    }

    /**
     * @return {min, max} valid columns for the requested row, or null when the row itself is invalid
     */
    public int[] getValidCols() {
        return validCols;
    }
}
