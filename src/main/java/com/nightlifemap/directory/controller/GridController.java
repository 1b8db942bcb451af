package com.nightlifemap.directory.controller;

import com.nightlifemap.directory.dto.GridDashboardDTO;
import com.nightlifemap.directory.dto.PlaceVenueRequest;
import com.nightlifemap.directory.dto.PlacementResult;
import com.nightlifemap.directory.dto.VenuePositionDTO;
import com.nightlifemap.directory.dto.ZoneLayoutDTO;
import com.nightlifemap.directory.exception.UnauthorizedException;
import com.nightlifemap.directory.service.AuthorizationService;
import com.nightlifemap.directory.service.GridPlacementService;
import com.nightlifemap.directory.service.GridQueryService;
import com.nightlifemap.directory.service.PlacementLeaseService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;

/**
 * REST controller for the venue map grid.
 * Placement requests are authorized and serialized per venue here before reaching the coordinator.
 */
@RestController
@RequestMapping("/grid")
@Tag(name = "Grid", description = "Venue placement on the zone grid")
public class GridController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(GridController.class);

    private final GridPlacementService placementService;
    private final GridQueryService queryService;
    private final AuthorizationService authorizationService;
    private final PlacementLeaseService leaseService;

    @Autowired
    public GridController(GridPlacementService placementService,
                          GridQueryService queryService,
                          AuthorizationService authorizationService,
                          PlacementLeaseService leaseService) {
        this.placementService = placementService;
        this.queryService = queryService;
        this.authorizationService = authorizationService;
        this.leaseService = leaseService;
    }

    @PostMapping("/placements")
    @Operation(summary = "Move a venue to a cell, swapping with the occupant if needed")
    public ResponseEntity<PlacementResult> placeVenue(
            @Valid @RequestBody PlaceVenueRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        String userRole = extractUserRole(httpRequest);

        if (!authorizationService.canPlaceVenue(userId, userRole, request.getVenueId())) {
            throw new UnauthorizedException("User " + userId + " may not place venue " + request.getVenueId());
        }

        logger.info("User {} placing venue {} at {}({},{}){}", userId, request.getVenueId(), request.getZone(),
            request.getRow(), request.getCol(),
            request.getSwapWithId() != null ? " swapping with " + request.getSwapWithId() : "");

        PlacementResult result = leaseService.runExclusively(
            Arrays.asList(request.getVenueId(), request.getSwapWithId()),
            () -> placementService.place(request.getVenueId(), request.getZone(),
                request.getRow(), request.getCol(), request.getSwapWithId()));

        return ResponseEntity.ok(result);
    }

    @GetMapping("/zones")
    @Operation(summary = "List the zones and their layouts")
    public ResponseEntity<List<ZoneLayoutDTO>> getZones() {
        return ResponseEntity.ok(queryService.getZones());
    }

    @GetMapping("/zones/{zone}/venues")
    @Operation(summary = "List the venues in a zone with their positions")
    public ResponseEntity<List<VenuePositionDTO>> getZoneVenues(@PathVariable String zone) {
        List<VenuePositionDTO> venues = queryService.getZoneVenues(zone);
        logger.debug("Retrieved {} venues for zone {}", venues.size(), zone);
        return ResponseEntity.ok(venues);
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Occupancy summary across all zones")
    public ResponseEntity<GridDashboardDTO> getDashboard() {
        return ResponseEntity.ok(queryService.getDashboard());
    }
}
