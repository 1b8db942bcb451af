package com.nightlifemap.directory.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Grid-wide occupancy summary. {@code detachedVenueIds} lists venues currently without a cell
 * after a swap, which should be empty outside of in-flight swaps.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GridDashboardDTO {

    private List<ZoneOccupancyDTO> zones;
    private int totalPlaced;
    private List<String> detachedVenueIds;
}
