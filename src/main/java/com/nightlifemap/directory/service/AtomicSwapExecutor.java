package com.nightlifemap.directory.service;

import com.nightlifemap.directory.config.GridProperties;
import com.nightlifemap.directory.exception.PlacementConflictException;
import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.repository.PositionTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Swaps two venues in one store transaction.
 *
 * An empty result means the atomic path was not available (switched off, or the transaction
 * failed for a reason other than a position condition) and nothing was written. A lost position
 * condition is a real conflict and propagates as {@link PlacementConflictException}.
 */
@Component
public class AtomicSwapExecutor {

    private static final Logger logger = LoggerFactory.getLogger(AtomicSwapExecutor.class);

    private final PositionTransactionRepository transactionRepository;
    private final GridProperties gridProperties;

    @Autowired
    public AtomicSwapExecutor(PositionTransactionRepository transactionRepository, GridProperties gridProperties) {
        this.transactionRepository = transactionRepository;
        this.gridProperties = gridProperties;
    }

    public Optional<SwapResult> trySwap(Venue source, Venue target, GridCell sourceNewCell, GridCell targetNewCell) {
        if (!gridProperties.getSwap().isAtomicEnabled()) {
            logger.debug("Atomic swap disabled, skipping for {} and {}", source.getVenueId(), target.getVenueId());
            return Optional.empty();
        }

        try {
            transactionRepository.exchangePositions(source, sourceNewCell, target, targetNewCell);
        } catch (PlacementConflictException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.warn("Atomic swap of {} and {} unavailable, falling back to sequential: {}",
                source.getVenueId(), target.getVenueId(), e.getMessage());
            return Optional.empty();
        }

        // TransactWriteItems returns no items; both writes committed exactly as requested
        Venue swappedSource = source.copy();
        swappedSource.placeAt(sourceNewCell);
        Venue swappedTarget = target.copy();
        swappedTarget.placeAt(targetNewCell);

        return Optional.of(new SwapResult(swappedSource, swappedTarget));
    }
}
