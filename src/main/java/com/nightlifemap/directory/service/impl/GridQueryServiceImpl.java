package com.nightlifemap.directory.service.impl;

import com.nightlifemap.directory.config.CacheConfig;
import com.nightlifemap.directory.dto.GridDashboardDTO;
import com.nightlifemap.directory.dto.VenuePositionDTO;
import com.nightlifemap.directory.dto.ZoneLayoutDTO;
import com.nightlifemap.directory.dto.ZoneOccupancyDTO;
import com.nightlifemap.directory.exception.ResourceNotFoundException;
import com.nightlifemap.directory.model.GridZone;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.model.ZoneShape;
import com.nightlifemap.directory.repository.VenuePositionRepository;
import com.nightlifemap.directory.service.GridQueryService;
import com.nightlifemap.directory.util.DirectoryKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Service
public class GridQueryServiceImpl implements GridQueryService {

    private static final Logger logger = LoggerFactory.getLogger(GridQueryServiceImpl.class);

    private final VenuePositionRepository positionRepository;

    @Autowired
    public GridQueryServiceImpl(VenuePositionRepository positionRepository) {
        this.positionRepository = positionRepository;
    }

    @Override
    public List<ZoneLayoutDTO> getZones() {
        return Arrays.stream(GridZone.values())
            .map(GridQueryServiceImpl::toLayout)
            .collect(Collectors.toList());
    }

    @Override
    @Cacheable(value = CacheConfig.ZONE_VENUES_CACHE, key = "#zone")
    public List<VenuePositionDTO> getZoneVenues(String zone) {
        GridZone gridZone = GridZone.fromId(zone)
            .orElseThrow(() -> new ResourceNotFoundException("Unknown zone: " + zone));

        logger.debug("Loading venues for zone {}", gridZone.getId());
        return positionRepository.findByZone(gridZone.getId()).stream()
            .map(VenuePositionDTO::from)
            .collect(Collectors.toList());
    }

    @Override
    @Cacheable(value = CacheConfig.GRID_DASHBOARD_CACHE, key = "'all'")
    public GridDashboardDTO getDashboard() {
        List<ZoneOccupancyDTO> zones = new ArrayList<>();
        List<String> detachedVenueIds = new ArrayList<>();
        int totalPlaced = 0;

        for (GridZone zone : GridZone.values()) {
            List<Venue> venues = positionRepository.findByZone(zone.getId());
            int placed = 0;
            int detached = 0;
            int unplaced = 0;
            for (Venue venue : venues) {
                if (venue.isPlaced()) {
                    placed++;
                } else if (DirectoryKeyFactory.STATE_DETACHED.equals(venue.getPlacementState())) {
                    detached++;
                    detachedVenueIds.add(venue.getVenueId());
                } else {
                    unplaced++;
                }
            }
            totalPlaced += placed;

            zones.add(ZoneOccupancyDTO.builder()
                .zone(zone.getId())
                .displayName(zone.getDisplayName())
                .cellCount(zone.getShape().getCellCount())
                .placedCount(placed)
                .detachedCount(detached)
                .unplacedCount(unplaced)
                .build());
        }

        if (!detachedVenueIds.isEmpty()) {
            logger.warn("Venues without a position after a swap: {}", detachedVenueIds);
        }

        return GridDashboardDTO.builder()
            .zones(zones)
            .totalPlaced(totalPlaced)
            .detachedVenueIds(detachedVenueIds)
            .build();
    }

    private static ZoneLayoutDTO toLayout(GridZone zone) {
        ZoneShape shape = zone.getShape();
        List<int[]> columnRanges = IntStream.rangeClosed(1, shape.getRows())
            .mapToObj(shape::columnRange)
            .collect(Collectors.toList());

        return ZoneLayoutDTO.builder()
            .id(zone.getId())
            .displayName(zone.getDisplayName())
            .rows(shape.getRows())
            .maxCols(shape.getMaxCols())
            .cellCount(shape.getCellCount())
            .columnRanges(columnRanges)
            .build();
    }
}
