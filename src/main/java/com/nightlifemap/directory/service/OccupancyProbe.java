package com.nightlifemap.directory.service;

import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.repository.VenuePositionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Answers "who is in this cell, other than me?".
 *
 * The read goes to the ZoneCellIndex and is not isolated from concurrent writers. A request
 * that loses the race is caught later by the conditional write, not here.
 */
@Component
public class OccupancyProbe {

    private static final Logger logger = LoggerFactory.getLogger(OccupancyProbe.class);

    private final VenuePositionRepository positionRepository;

    @Autowired
    public OccupancyProbe(VenuePositionRepository positionRepository) {
        this.positionRepository = positionRepository;
    }

    public Optional<String> findOccupant(GridCell cell, String excludingVenueId) {
        Optional<String> occupant = positionRepository.findOccupant(cell, excludingVenueId);
        logger.debug("Cell {} occupant (excluding {}): {}", cell, excludingVenueId, occupant.orElse("none"));
        return occupant;
    }
}
