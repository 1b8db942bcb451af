package com.nightlifemap.directory.service.impl;

import com.nightlifemap.directory.dto.PlacementResult;
import com.nightlifemap.directory.dto.VenuePositionDTO;
import com.nightlifemap.directory.exception.PlacementConflictException;
import com.nightlifemap.directory.exception.ValidationException;
import com.nightlifemap.directory.exception.VenueNotFoundException;
import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.repository.VenuePositionRepository;
import com.nightlifemap.directory.service.AtomicSwapExecutor;
import com.nightlifemap.directory.service.GridCacheInvalidator;
import com.nightlifemap.directory.service.GridPlacementService;
import com.nightlifemap.directory.service.OccupancyProbe;
import com.nightlifemap.directory.service.SequentialSwapFallback;
import com.nightlifemap.directory.service.SwapResult;
import com.nightlifemap.directory.service.ZoneShapeValidator;
import com.nightlifemap.directory.util.DirectoryKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of GridPlacementService.
 *
 * Input and shape checks run before any store access. A move onto an occupied cell is escalated
 * to a swap with the occupant. Swaps try the transactional exchange first and fall back to the
 * three-phase sequential protocol.
 */
@Service
public class GridPlacementServiceImpl implements GridPlacementService {

    private static final Logger logger = LoggerFactory.getLogger(GridPlacementServiceImpl.class);

    private final ZoneShapeValidator shapeValidator;
    private final VenuePositionRepository positionRepository;
    private final OccupancyProbe occupancyProbe;
    private final AtomicSwapExecutor atomicSwapExecutor;
    private final SequentialSwapFallback sequentialSwapFallback;
    private final GridCacheInvalidator cacheInvalidator;

    @Autowired
    public GridPlacementServiceImpl(ZoneShapeValidator shapeValidator,
                                    VenuePositionRepository positionRepository,
                                    OccupancyProbe occupancyProbe,
                                    AtomicSwapExecutor atomicSwapExecutor,
                                    SequentialSwapFallback sequentialSwapFallback,
                                    GridCacheInvalidator cacheInvalidator) {
        this.shapeValidator = shapeValidator;
        this.positionRepository = positionRepository;
        this.occupancyProbe = occupancyProbe;
        this.atomicSwapExecutor = atomicSwapExecutor;
        this.sequentialSwapFallback = sequentialSwapFallback;
        this.cacheInvalidator = cacheInvalidator;
    }

    @Override
    public PlacementResult place(String venueId, String zone, Integer row, Integer col, String swapWithId) {
        String swapTargetId = (swapWithId == null || swapWithId.isBlank()) ? null : swapWithId;
        validateInput(venueId, zone, row, col, swapTargetId);
        shapeValidator.requireValid(zone, row, col);

        GridCell requestedCell = new GridCell(zone, row, col);
        Venue source = findVenue(venueId);

        if (swapTargetId != null) {
            return explicitSwap(source, findVenue(swapTargetId), requestedCell);
        }

        Optional<String> occupantId = occupancyProbe.findOccupant(requestedCell, venueId);
        if (occupantId.isEmpty()) {
            return simpleMove(source, requestedCell);
        }

        // The index may lag; confirm the occupant with a consistent read before touching it
        Venue occupant = positionRepository.findById(occupantId.get())
            .filter(v -> v.getCell().filter(requestedCell::equals).isPresent())
            .orElseThrow(() -> new PlacementConflictException(
                "Occupancy of " + requestedCell + " changed while placing venue " + venueId));

        logger.debug("Cell {} held by {}, escalating move of {} to swap", requestedCell, occupant.getVenueId(), venueId);
        return swap(source, occupant, requestedCell, true);
    }

    private void validateInput(String venueId, String zone, Integer row, Integer col, String swapWithId) {
        if (venueId == null || venueId.isBlank()) {
            throw new ValidationException("Venue ID is required");
        }
        if (!DirectoryKeyFactory.isValidId(venueId)) {
            throw new ValidationException("Invalid venue ID format: " + venueId);
        }
        if (zone == null || zone.isBlank()) {
            throw new ValidationException("Zone is required");
        }
        if (row == null || col == null) {
            throw new ValidationException("Row and column are required");
        }
        if (row < 1 || col < 1) {
            throw new ValidationException("Row and column must be at least 1");
        }
        if (swapWithId != null) {
            if (!DirectoryKeyFactory.isValidId(swapWithId)) {
                throw new ValidationException("Invalid swap venue ID format: " + swapWithId);
            }
            if (swapWithId.equalsIgnoreCase(venueId)) {
                throw new ValidationException("A venue cannot be swapped with itself");
            }
        }
    }

    private Venue findVenue(String venueId) {
        return positionRepository.findById(venueId)
            .orElseThrow(() -> new VenueNotFoundException(venueId));
    }

    private PlacementResult simpleMove(Venue source, GridCell requestedCell) {
        String previousZone = source.getZone();
        Venue moved = positionRepository.updatePosition(source, requestedCell);

        logger.info("Moved venue {} from {} to {}", source.getVenueId(), describe(source), requestedCell);
        cacheInvalidator.zonesChanged(Arrays.asList(previousZone, requestedCell.zone()));

        return PlacementResult.builder()
            .operation(PlacementResult.Operation.MOVE)
            .path(PlacementResult.Path.SIMPLE)
            .escalated(false)
            .venues(List.of(VenuePositionDTO.from(moved)))
            .build();
    }

    private PlacementResult explicitSwap(Venue source, Venue target, GridCell requestedCell) {
        if (source.getCell().filter(requestedCell::equals).isPresent()) {
            throw new ValidationException("Venue " + source.getVenueId() + " is already at " + requestedCell);
        }

        Optional<String> occupantId = occupancyProbe.findOccupant(requestedCell, source.getVenueId());
        if (occupantId.isPresent() && !occupantId.get().equalsIgnoreCase(target.getVenueId())) {
            throw new ValidationException("Target position is occupied by a different venue than "
                + target.getVenueId());
        }

        return swap(source, target, requestedCell, false);
    }

    private PlacementResult swap(Venue source, Venue target, GridCell requestedCell, boolean escalated) {
        GridCell sourceOriginal = source.getCell()
            .orElseThrow(() -> new ValidationException(
                "Venue " + source.getVenueId() + " has no position to trade with " + target.getVenueId()));

        PlacementResult.Path path;
        SwapResult swapped;
        Optional<SwapResult> atomic = atomicSwapExecutor.trySwap(source, target, requestedCell, sourceOriginal);
        if (atomic.isPresent()) {
            swapped = atomic.get();
            path = PlacementResult.Path.ATOMIC;
        } else {
            swapped = sequentialSwapFallback.execute(source, target, requestedCell);
            path = PlacementResult.Path.SEQUENTIAL;
        }

        logger.info("Swapped venue {} ({} -> {}) with venue {} ({} -> {}) via {} path",
            source.getVenueId(), sourceOriginal, requestedCell,
            target.getVenueId(), describe(target), sourceOriginal, path);
        cacheInvalidator.zonesChanged(Arrays.asList(sourceOriginal.zone(), requestedCell.zone(), target.getZone()));

        return PlacementResult.builder()
            .operation(PlacementResult.Operation.SWAP)
            .path(path)
            .escalated(escalated)
            .venues(List.of(VenuePositionDTO.from(swapped.source()), VenuePositionDTO.from(swapped.target())))
            .build();
    }

    private static String describe(Venue venue) {
        return venue.getCell().map(GridCell::toString).orElse(venue.getZone() + "(no cell)");
    }
}
