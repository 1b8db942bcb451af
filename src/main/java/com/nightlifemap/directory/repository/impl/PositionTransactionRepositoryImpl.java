package com.nightlifemap.directory.repository.impl;

import com.nightlifemap.directory.exception.PlacementConflictException;
import com.nightlifemap.directory.exception.TransactionFailedException;
import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.repository.PositionTransactionRepository;
import com.nightlifemap.directory.util.DirectoryKeyFactory;
import com.nightlifemap.directory.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.List;

/**
 * Implementation of PositionTransactionRepository using TransactWriteItems.
 * Both venues are written with the same expected-position conditions as the single-row path.
 */
@Repository
public class PositionTransactionRepositoryImpl implements PositionTransactionRepository {

    private static final Logger logger = LoggerFactory.getLogger(PositionTransactionRepositoryImpl.class);
    private static final String TABLE_NAME = DirectoryKeyFactory.TABLE_NAME;
    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public PositionTransactionRepositoryImpl(DynamoDbClient dynamoDbClient,
                                             QueryPerformanceTracker performanceTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
    }

    @Override
    public void exchangePositions(Venue source, GridCell sourceNewCell, Venue target, GridCell targetNewCell) {
        performanceTracker.trackQuery("exchangePositions", TABLE_NAME, () -> {
            try {
                long now = System.currentTimeMillis();

                TransactWriteItemsRequest request = TransactWriteItemsRequest.builder()
                    .transactItems(
                        moveItem(source, sourceNewCell, now),
                        moveItem(target, targetNewCell, now)
                    )
                    .build();

                dynamoDbClient.transactWriteItems(request);

                logger.info("Exchanged positions: {} -> {}, {} -> {}",
                    source.getVenueId(), sourceNewCell, target.getVenueId(), targetNewCell);

            } catch (TransactionCanceledException e) {
                if (hasConditionFailure(e.cancellationReasons())) {
                    logger.warn("Exchange of {} and {} cancelled, a position changed concurrently: {}",
                        source.getVenueId(), target.getVenueId(), e.cancellationReasons());
                    throw new PlacementConflictException(
                        "Venue position changed concurrently during swap", e);
                }
                logger.error("Transaction cancelled while exchanging {} and {}: {}",
                    source.getVenueId(), target.getVenueId(), e.cancellationReasons());
                throw new TransactionFailedException("Failed to exchange positions atomically", e);
            } catch (DynamoDbException | SdkClientException e) {
                logger.error("DynamoDB error while exchanging {} and {}",
                    source.getVenueId(), target.getVenueId(), e);
                throw new TransactionFailedException("Atomic exchange unavailable", e);
            }

            return null;
        });
    }

    private TransactWriteItem moveItem(Venue expected, GridCell newCell, long now) {
        return TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(PositionExpressions.venueKey(expected.getVenueId()))
                .updateExpression(PositionExpressions.MOVE_UPDATE)
                .conditionExpression(PositionExpressions.expectedCondition(expected))
                .expressionAttributeNames(PositionExpressions.ATTRIBUTE_NAMES)
                .expressionAttributeValues(PositionExpressions.moveValues(expected, newCell, now))
                .build())
            .build();
    }

    private static boolean hasConditionFailure(List<CancellationReason> reasons) {
        if (reasons == null) {
            return false;
        }
        return reasons.stream()
            .anyMatch(reason -> CONDITIONAL_CHECK_FAILED.equals(reason.code()));
    }
}
