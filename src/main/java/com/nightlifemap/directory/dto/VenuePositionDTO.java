package com.nightlifemap.directory.dto;

import com.nightlifemap.directory.model.Venue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A venue's position as returned to clients. Row and column are null while the venue has no cell.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VenuePositionDTO {

    private String venueId;
    private String name;
    private String zone;
    private Integer row;
    private Integer col;
    private String placementState;
    private Long updatedAt;

    public static VenuePositionDTO from(Venue venue) {
        return VenuePositionDTO.builder()
            .venueId(venue.getVenueId())
            .name(venue.getName())
            .zone(venue.getZone())
            .row(venue.getGridRow())
            .col(venue.getGridCol())
            .placementState(venue.getPlacementState())
            .updatedAt(venue.getUpdatedAt() != null ? venue.getUpdatedAt().toEpochMilli() : null)
            .build();
    }
}
