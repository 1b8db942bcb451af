package com.nightlifemap.directory.repository;

import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;

import java.util.List;
import java.util.Optional;

/**
 * Single-row access to venue positions in the DirectoryTable.
 *
 * Every write is conditional on the venue still holding the position it had in {@code expected};
 * a failed condition surfaces as {@link com.nightlifemap.directory.exception.PlacementConflictException}.
 * No write here touches more than one item.
 */
public interface VenuePositionRepository {

    /**
     * Strongly consistent point read of a venue.
     * @param venueId The venue ID
     * @return Optional containing the venue if it exists
     */
    Optional<Venue> findById(String venueId);

    /**
     * Find the venue placed in a cell, ignoring one venue.
     * Reads the ZoneCellIndex GSI, so the answer may lag concurrent writers.
     * @param cell The cell to inspect
     * @param excludingVenueId Venue to ignore (normally the one being moved)
     * @return Optional containing the occupant's venue ID
     */
    Optional<String> findOccupant(GridCell cell, String excludingVenueId);

    /**
     * All venues listed under a zone, placed or not, in row-major cell order.
     * @param zone The zone identifier
     * @return Venues in the zone
     */
    List<Venue> findByZone(String zone);

    /**
     * Conditionally move a venue into a cell.
     * @param expected The venue as last read; its zone and cell (or lack of one) must still match
     * @param newCell The cell to occupy
     * @return The venue as stored after the write
     */
    Venue updatePosition(Venue expected, GridCell newCell);

    /**
     * Conditionally clear a placed venue's cell. The venue keeps its zone.
     * @param expected The venue as last read; must still be in the same cell
     * @return The detached venue as stored after the write
     */
    Venue detach(Venue expected);

    /**
     * Conditionally return a placed venue to the never-placed state in {@code zone}. Only used to
     * undo a swap whose target had no cell to begin with, possibly in another zone.
     * @param expected The venue as last read; must still be in the same cell
     * @param zone The zone the venue is listed under afterwards
     * @return The venue as stored after the write
     */
    Venue unplace(Venue expected, String zone);
}
