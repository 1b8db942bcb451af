package com.nightlifemap.directory.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for placing a venue on the grid, optionally swapping with another venue.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlaceVenueRequest {

    @NotBlank(message = "Venue ID is required")
    @Pattern(regexp = "[0-9a-fA-F-]{36}", message = "Invalid venue ID format")
    private String venueId;

    @NotBlank(message = "Zone is required")
    private String zone;

    @NotNull(message = "Row is required")
    @Min(value = 1, message = "Row must be at least 1")
    private Integer row;

    @NotNull(message = "Column is required")
    @Min(value = 1, message = "Column must be at least 1")
    private Integer col;

    @Pattern(regexp = "[0-9a-fA-F-]{36}", message = "Invalid swap venue ID format")
    private String swapWithId;
}
