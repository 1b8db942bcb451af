package com.nightlifemap.directory.service;

import com.nightlifemap.directory.config.GridProperties;
import com.nightlifemap.directory.exception.PlacementInProgressException;
import com.nightlifemap.directory.repository.PlacementLeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Objects;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Per-venue advisory gate: at most one placement runs per venue at a time.
 *
 * Leases are taken in sorted venue order so two requests naming the same pair cannot hold one each.
 * A lease that is never released lapses after {@code grid.lease.duration}.
 */
@Service
public class PlacementLeaseService {

    private static final Logger logger = LoggerFactory.getLogger(PlacementLeaseService.class);

    private final PlacementLeaseRepository leaseRepository;
    private final GridProperties gridProperties;

    @Autowired
    public PlacementLeaseService(PlacementLeaseRepository leaseRepository, GridProperties gridProperties) {
        this.leaseRepository = leaseRepository;
        this.gridProperties = gridProperties;
    }

    /**
     * Run {@code action} while holding leases on every named venue.
     *
     * @throws PlacementInProgressException if another placement holds one of the leases
     */
    public <T> T runExclusively(Collection<String> venueIds, Supplier<T> action) {
        if (!gridProperties.getLease().isEnabled()) {
            return action.get();
        }

        TreeSet<String> ordered = new TreeSet<>();
        venueIds.stream().filter(Objects::nonNull).forEach(ordered::add);

        String token = UUID.randomUUID().toString();
        Instant expiresAt = Instant.now().plus(gridProperties.getLease().getDuration());
        Deque<String> held = new ArrayDeque<>();

        try {
            for (String venueId : ordered) {
                if (!leaseRepository.tryAcquire(venueId, token, expiresAt)) {
                    throw new PlacementInProgressException(venueId);
                }
                held.push(venueId);
            }
            return action.get();
        } finally {
            while (!held.isEmpty()) {
                String venueId = held.pop();
                try {
                    leaseRepository.release(venueId, token);
                } catch (RuntimeException e) {
                    // The lease lapses on its own once expired
                    logger.warn("Failed to release lease on venue {}, it expires at {}: {}",
                        venueId, expiresAt, e.getMessage());
                }
            }
        }
    }
}
