package com.nightlifemap.directory.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a successful placement.
 *
 * For a swap the source venue comes first in {@link #getVenues()}, then the target.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlacementResult {

    public enum Operation {
        MOVE,
        SWAP
    }

    public enum Path {
        SIMPLE,
        ATOMIC,
        SEQUENTIAL
    }

    private Operation operation;
    private Path path;
    private boolean escalated;
    private List<VenuePositionDTO> venues;
}
