package com.nightlifemap.directory.model;

import java.util.Arrays;

/**
 * Cell layout of a zone: which (row, col) pairs exist.
 *
 * Every layout is described row by row as an inclusive column range, which covers plain
 * rectangles as well as zones with masked cells at a junction.
 */
public final class ZoneShape {

    private final int[][] columnRanges; // index = row - 1, value = {minCol, maxCol}

    private ZoneShape(int[][] columnRanges) {
        this.columnRanges = columnRanges;
    }

    public static ZoneShape rectangle(int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Zone dimensions must be positive");
        }
        int[][] ranges = new int[rows][];
        for (int i = 0; i < rows; i++) {
            ranges[i] = new int[] {1, cols};
        }
        return new ZoneShape(ranges);
    }

    /**
     * Start from a rectangle and narrow individual rows.
     */
    public static Builder builder(int rows, int cols) {
        return new Builder(rows, cols);
    }

    public boolean contains(int row, int col) {
        if (row < 1 || row > columnRanges.length) {
            return false;
        }
        int[] range = columnRanges[row - 1];
        return col >= range[0] && col <= range[1];
    }

    public int getRows() {
        return columnRanges.length;
    }

    /**
     * Widest column index used by any row.
     */
    public int getMaxCols() {
        return Arrays.stream(columnRanges).mapToInt(r -> r[1]).max().orElse(0);
    }

    public int getCellCount() {
        return Arrays.stream(columnRanges).mapToInt(r -> r[1] - r[0] + 1).sum();
    }

    /**
     * @return {minCol, maxCol} for the row, or null if the row is outside the zone
     */
    public int[] columnRange(int row) {
        if (row < 1 || row > columnRanges.length) {
            return null;
        }
        return columnRanges[row - 1].clone();
    }

    public static final class Builder {
        private final int[][] ranges;

        private Builder(int rows, int cols) {
            this.ranges = rectangle(rows, cols).columnRanges;
        }

        public Builder row(int row, int minCol, int maxCol) {
            if (minCol > maxCol) {
                throw new IllegalArgumentException("Row " + row + " has an empty column range");
            }
            ranges[row - 1] = new int[] {minCol, maxCol};
            return this;
        }

        /**
         * Exclude the last {@code count} columns of a row.
         */
        public Builder maskTrailing(int row, int count) {
            int[] range = ranges[row - 1];
            return row(row, range[0], range[1] - count);
        }

        /**
         * Exclude the first {@code count} columns of a row.
         */
        public Builder maskLeading(int row, int count) {
            int[] range = ranges[row - 1];
            return row(row, range[0] + count, range[1]);
        }

        public ZoneShape build() {
            return new ZoneShape(ranges);
        }
    }
}
