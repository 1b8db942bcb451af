package com.nightlifemap.directory.repository;

import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;

/**
 * The store's one multi-row atomic procedure: exchanging two venues' cells in a single
 * DynamoDB transaction. Either both writes commit or neither does.
 */
public interface PositionTransactionRepository {

    /**
     * Atomically move {@code source} into {@code sourceNewCell} and {@code target} into
     * {@code targetNewCell}, each conditional on the venue still holding its read position.
     *
     * @throws com.nightlifemap.directory.exception.PlacementConflictException if a position condition failed
     * @throws com.nightlifemap.directory.exception.TransactionFailedException for any other failure
     */
    void exchangePositions(Venue source, GridCell sourceNewCell, Venue target, GridCell targetNewCell);
}
