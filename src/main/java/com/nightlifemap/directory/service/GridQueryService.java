package com.nightlifemap.directory.service;

import com.nightlifemap.directory.dto.GridDashboardDTO;
import com.nightlifemap.directory.dto.VenuePositionDTO;
import com.nightlifemap.directory.dto.ZoneLayoutDTO;

import java.util.List;

/**
 * Read-only views of the grid.
 */
public interface GridQueryService {

    List<ZoneLayoutDTO> getZones();

    /**
     * Venues listed under a zone, placed venues first in row-major order.
     */
    List<VenuePositionDTO> getZoneVenues(String zone);

    GridDashboardDTO getDashboard();
}
