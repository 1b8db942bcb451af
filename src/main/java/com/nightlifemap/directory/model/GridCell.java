package com.nightlifemap.directory.model;

/**
 * A {@code (zone, row, col)} coordinate on the venue map. Rows and columns are 1-based.
 */
public record GridCell(String zone, int row, int col) {

    public GridCell {
        if (zone == null || zone.isBlank()) {
            throw new IllegalArgumentException("zone is required");
        }
    }

    @Override
    public String toString() {
        return zone + "(" + row + "," + col + ")";
    }
}
