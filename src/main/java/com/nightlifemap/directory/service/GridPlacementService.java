package com.nightlifemap.directory.service;

import com.nightlifemap.directory.dto.PlacementResult;

/**
 * Places venues on the zone grid.
 */
public interface GridPlacementService {

    /**
     * Move a venue to a cell, or swap it with another venue.
     *
     * Without {@code swapWithId} the venue moves into the cell if it is empty and trades places
     * with the occupant if it is not. With {@code swapWithId} the two venues trade places and the
     * cell must be empty or held by that venue.
     *
     * @param venueId The venue to place
     * @param zone Target zone identifier
     * @param row Target row, 1-based
     * @param col Target column, 1-based
     * @param swapWithId Optional explicit swap partner
     * @return the updated venue records
     */
    PlacementResult place(String venueId, String zone, Integer row, Integer col, String swapWithId);
}
