package com.nightlifemap.directory.service;

import com.nightlifemap.directory.exception.PlacementConflictException;
import com.nightlifemap.directory.exception.PlacementFatalException;
import com.nightlifemap.directory.exception.SwapFailedException;
import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.repository.VenuePositionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Swaps two venues with three single-row conditional writes when no transaction is available.
 *
 * Phases:
 * 1. Detach the source (keeps its zone). Frees the source's cell without claiming the requested one.
 * 2. Move the target into the source's original cell.
 * 3. Move the source into the requested cell.
 *
 * A failure in phase 2 restores the source. A failure in phase 3 puts the target back, then the
 * source. If a restoring write fails the source may be left detached: that is the FATAL outcome,
 * logged under the {@code FATAL} marker and counted in {@code grid.placement.fatal}.
 *
 * Each write is conditioned on the record returned by the previous one, so a venue touched by
 * someone else mid-swap fails the write instead of being overwritten. A failed write that is not a
 * condition failure may still have been applied (a timeout, for instance), so the venue it targeted
 * is re-read before anything is undone; if it cannot be re-read the swap is FATAL.
 */
@Component
public class SequentialSwapFallback {

    private static final Logger logger = LoggerFactory.getLogger(SequentialSwapFallback.class);
    private static final Marker FATAL_MARKER = MarkerFactory.getMarker("FATAL");

    public static final String FATAL_COUNTER = "grid.placement.fatal";

    private final VenuePositionRepository positionRepository;
    private final Counter fatalCounter;

    @Autowired
    public SequentialSwapFallback(VenuePositionRepository positionRepository, MeterRegistry meterRegistry) {
        this.positionRepository = positionRepository;
        this.fatalCounter = Counter.builder(FATAL_COUNTER)
            .description("Swaps whose rollback failed and left a venue without a position")
            .register(meterRegistry);
    }

    /**
     * Run the protocol to a terminal state.
     *
     * @param source The venue being placed, as read; must hold a cell
     * @param target The venue it trades places with, as read; may have no cell
     * @param requestedCell Where the source should end up
     * @return both venues after the swap
     * @throws PlacementConflictException if the source changed before it could be detached
     * @throws SwapFailedException if the swap failed and was fully undone
     * @throws PlacementFatalException if undoing the swap failed
     */
    public SwapResult execute(Venue source, Venue target, GridCell requestedCell) {
        GridCell sourceOriginal = source.getCell()
            .orElseThrow(() -> new IllegalArgumentException("Source venue " + source.getVenueId() + " has no cell"));

        SwapPhase phase = SwapPhase.IDLE;

        // Phase 1: nothing has been written if this fails
        Venue detachedSource;
        try {
            detachedSource = positionRepository.detach(source);
        } catch (PlacementConflictException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Swap of {} and {} aborted, could not detach source from {}",
                source.getVenueId(), target.getVenueId(), sourceOriginal, e);
            throw new SwapFailedException("Swap could not be started, no positions changed", e);
        }
        phase = advance(phase, SwapPhase.SOURCE_DETACHED, source, target);

        // Phase 2
        Venue relocatedTarget;
        try {
            relocatedTarget = positionRepository.updatePosition(target, sourceOriginal);
        } catch (RuntimeException e) {
            logger.error("Swap of {} and {} failed moving target into {}, restoring source",
                source.getVenueId(), target.getVenueId(), sourceOriginal, e);
            try {
                Optional<Venue> landedTarget = appliedDespiteFailure(e, target.getVenueId(), sourceOriginal);
                if (landedTarget.isPresent()) {
                    restoreTarget(landedTarget.get(), target);
                }
                positionRepository.updatePosition(detachedSource, sourceOriginal);
            } catch (RuntimeException rollbackFailure) {
                rollbackFailure.addSuppressed(e);
                throw fatal(source, sourceOriginal, phase, rollbackFailure);
            }
            advance(phase, SwapPhase.ROLLED_BACK, source, target);
            throw new SwapFailedException("Swap failed and was rolled back: " + e.getMessage(), e);
        }
        phase = advance(phase, SwapPhase.TARGET_RELOCATED, source, target);

        // Phase 3
        Venue placedSource;
        try {
            placedSource = positionRepository.updatePosition(detachedSource, requestedCell);
        } catch (RuntimeException e) {
            Optional<Venue> landedSource;
            try {
                landedSource = appliedDespiteFailure(e, source.getVenueId(), requestedCell);
            } catch (RuntimeException rereadFailure) {
                rereadFailure.addSuppressed(e);
                throw fatal(source, sourceOriginal, phase, rereadFailure);
            }
            if (landedSource.isPresent()) {
                logger.warn("Swap of {} and {}: placing source in {} reported failure but was applied",
                    source.getVenueId(), target.getVenueId(), requestedCell, e);
                advance(phase, SwapPhase.DONE, source, target);
                return new SwapResult(landedSource.get(), relocatedTarget);
            }

            logger.error("Swap of {} and {} failed moving source into {}, restoring both",
                source.getVenueId(), target.getVenueId(), requestedCell, e);
            try {
                restoreTarget(relocatedTarget, target);
                positionRepository.updatePosition(detachedSource, sourceOriginal);
            } catch (RuntimeException rollbackFailure) {
                rollbackFailure.addSuppressed(e);
                throw fatal(source, sourceOriginal, phase, rollbackFailure);
            }
            advance(phase, SwapPhase.ROLLED_BACK, source, target);
            throw new SwapFailedException("Swap failed and was rolled back: " + e.getMessage(), e);
        }
        advance(phase, SwapPhase.DONE, source, target);

        return new SwapResult(placedSource, relocatedTarget);
    }

    /**
     * After a failed write, return the venue as stored if the write nevertheless put it in {@code cell}.
     * A condition failure means nothing was written.
     */
    private Optional<Venue> appliedDespiteFailure(RuntimeException failure, String venueId, GridCell cell) {
        if (failure instanceof PlacementConflictException) {
            return Optional.empty();
        }
        Venue current = positionRepository.findById(venueId)
            .orElseThrow(() -> new IllegalStateException("Venue " + venueId + " disappeared during swap"));
        return current.getCell().filter(cell::equals).isPresent() ? Optional.of(current) : Optional.empty();
    }

    /**
     * Put the target back where it was before the swap, including its zone when it had no cell.
     */
    private void restoreTarget(Venue current, Venue original) {
        Optional<GridCell> originalCell = original.getCell();
        if (originalCell.isPresent()) {
            positionRepository.updatePosition(current, originalCell.get());
        } else {
            positionRepository.unplace(current, original.getZone());
        }
    }

    private SwapPhase advance(SwapPhase from, SwapPhase to, Venue source, Venue target) {
        logger.debug("Swap {} <-> {}: {} -> {}", source.getVenueId(), target.getVenueId(), from, to);
        return to;
    }

    private PlacementFatalException fatal(Venue source, GridCell sourceOriginal, SwapPhase phase,
                                          RuntimeException cause) {
        fatalCounter.increment();
        logger.error(FATAL_MARKER,
            "Swap rollback failed: {} -> {}, venue {} may be left without a position, original cell {}. "
                + "Manual repair required.",
            phase, SwapPhase.FATAL, source.getVenueId(), sourceOriginal, cause);
        return new PlacementFatalException(
            "Swap rollback failed; venue " + source.getVenueId() + " may have no position and needs manual repair",
            source.getVenueId(), sourceOriginal, cause);
    }
}
