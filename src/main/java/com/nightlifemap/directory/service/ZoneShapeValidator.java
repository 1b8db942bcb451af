package com.nightlifemap.directory.service;

import com.nightlifemap.directory.exception.OutOfBoundsException;
import com.nightlifemap.directory.model.GridZone;
import com.nightlifemap.directory.model.ZoneShape;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides whether a cell exists in a zone's layout.
 * Pure lookup over {@link GridZone}; unknown zones are never valid.
 */
@Component
public class ZoneShapeValidator {

    public boolean isValid(String zone, int row, int col) {
        return GridZone.fromId(zone)
            .map(z -> z.contains(row, col))
            .orElse(false);
    }

    /**
     * Throw {@link OutOfBoundsException} describing the valid ranges if the cell is not in the zone.
     */
    public void requireValid(String zone, int row, int col) {
        if (isValid(zone, row, col)) {
            return;
        }

        Optional<GridZone> known = GridZone.fromId(zone);
        if (known.isEmpty()) {
            throw new OutOfBoundsException("Unknown zone: " + zone, zone, row, col, null, null);
        }

        ZoneShape shape = known.get().getShape();
        int[] validRows = {1, shape.getRows()};
        int[] validCols = shape.columnRange(row);
        String details = validCols == null
            ? String.format("%s rows must be between 1 and %d.", known.get().getDisplayName(), shape.getRows())
            : String.format("%s row %d columns must be between %d and %d.",
                known.get().getDisplayName(), row, validCols[0], validCols[1]);

        throw new OutOfBoundsException("Position (" + row + "," + col + ") is outside " + zone + ". " + details,
            zone, row, col, validRows, validCols);
    }
}
