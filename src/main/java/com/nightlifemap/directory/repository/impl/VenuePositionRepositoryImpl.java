package com.nightlifemap.directory.repository.impl;

import com.nightlifemap.directory.exception.PlacementConflictException;
import com.nightlifemap.directory.exception.RepositoryException;
import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.repository.VenuePositionRepository;
import com.nightlifemap.directory.util.DirectoryKeyFactory;
import com.nightlifemap.directory.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementation of VenuePositionRepository using the DynamoDB direct client.
 * Position writes are single UpdateItem calls guarded by the expected-position condition.
 */
@Repository
public class VenuePositionRepositoryImpl implements VenuePositionRepository {

    private static final Logger logger = LoggerFactory.getLogger(VenuePositionRepositoryImpl.class);
    private static final String TABLE_NAME = DirectoryKeyFactory.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Venue> venueSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public VenuePositionRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.venueSchema = TableSchema.fromBean(Venue.class);
    }

    @Override
    public Optional<Venue> findById(String venueId) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(PositionExpressions.venueKey(venueId))
                    .consistentRead(true)
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }

                return Optional.of(venueSchema.mapToItem(response.item()));

            } catch (DynamoDbException | SdkClientException e) {
                logger.error("Failed to read venue {}", venueId, e);
                throw new RepositoryException("Failed to retrieve venue", e);
            }
        });
    }

    @Override
    public Optional<String> findOccupant(GridCell cell, String excludingVenueId) {
        return queryTracker.trackQuery("Query-GSI", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(DirectoryKeyFactory.ZONE_CELL_INDEX)
                    .keyConditionExpression("gsi1pk = :gsi1pk AND gsi1sk = :gsi1sk")
                    .expressionAttributeValues(Map.of(
                        ":gsi1pk", AttributeValue.builder().s(DirectoryKeyFactory.getZoneGsi1Pk(cell.zone())).build(),
                        ":gsi1sk", AttributeValue.builder().s(DirectoryKeyFactory.getCellGsi1Sk(cell.row(), cell.col())).build()
                    ))
                    .build();

                QueryResponse response = dynamoDbClient.query(request);

                List<String> occupants = response.items().stream()
                    .map(item -> item.get("venueId"))
                    .filter(value -> value != null && value.s() != null)
                    .map(AttributeValue::s)
                    .filter(id -> !id.equals(excludingVenueId))
                    .collect(Collectors.toList());

                if (occupants.size() > 1) {
                    logger.warn("Cell {} holds {} venues: {}", cell, occupants.size(), occupants);
                }

                return occupants.stream().findFirst();

            } catch (DynamoDbException | SdkClientException e) {
                logger.error("Failed to check occupancy of {}", cell, e);
                throw new RepositoryException("Failed to check target position", e);
            }
        });
    }

    @Override
    public List<Venue> findByZone(String zone) {
        return queryTracker.trackQuery("Query-GSI", TABLE_NAME, () -> {
            try {
                List<Venue> venues = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;

                do {
                    QueryRequest.Builder builder = QueryRequest.builder()
                        .tableName(TABLE_NAME)
                        .indexName(DirectoryKeyFactory.ZONE_CELL_INDEX)
                        .keyConditionExpression("gsi1pk = :gsi1pk")
                        .expressionAttributeValues(Map.of(
                            ":gsi1pk", AttributeValue.builder().s(DirectoryKeyFactory.getZoneGsi1Pk(zone)).build()
                        ));
                    if (startKey != null) {
                        builder.exclusiveStartKey(startKey);
                    }

                    QueryResponse response = dynamoDbClient.query(builder.build());
                    response.items().stream()
                        .map(venueSchema::mapToItem)
                        .forEach(venues::add);

                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey()
                        : null;
                } while (startKey != null);

                return venues;

            } catch (DynamoDbException | SdkClientException e) {
                logger.error("Failed to list venues in zone {}", zone, e);
                throw new RepositoryException("Failed to retrieve zone venues", e);
            }
        });
    }

    @Override
    public Venue updatePosition(Venue expected, GridCell newCell) {
        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(PositionExpressions.venueKey(expected.getVenueId()))
                    .updateExpression(PositionExpressions.MOVE_UPDATE)
                    .conditionExpression(PositionExpressions.expectedCondition(expected))
                    .expressionAttributeNames(PositionExpressions.ATTRIBUTE_NAMES)
                    .expressionAttributeValues(PositionExpressions.moveValues(expected, newCell, System.currentTimeMillis()))
                    .returnValues(ReturnValue.ALL_NEW)
                    .build();

                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                logger.debug("Venue {} now at {}", expected.getVenueId(), newCell);
                return venueSchema.mapToItem(response.attributes());

            } catch (ConditionalCheckFailedException e) {
                logger.warn("Venue {} moved since it was read, expected {}", expected.getVenueId(), describe(expected));
                throw new PlacementConflictException(
                    "Venue " + expected.getVenueId() + " changed position concurrently", e);
            } catch (DynamoDbException | SdkClientException e) {
                logger.error("Failed to move venue {} to {}", expected.getVenueId(), newCell, e);
                throw new RepositoryException("Failed to update position", e);
            }
        });
    }

    @Override
    public Venue detach(Venue expected) {
        return clearCell(expected, expected.getZone(), DirectoryKeyFactory.STATE_DETACHED);
    }

    @Override
    public Venue unplace(Venue expected, String zone) {
        return clearCell(expected, zone, DirectoryKeyFactory.STATE_UNPLACED);
    }

    private Venue clearCell(Venue expected, String zone, String state) {
        if (!expected.isPlaced()) {
            throw new IllegalArgumentException("Venue " + expected.getVenueId() + " has no cell to release");
        }

        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(PositionExpressions.venueKey(expected.getVenueId()))
                    .updateExpression(PositionExpressions.CLEAR_CELL_UPDATE)
                    .conditionExpression(PositionExpressions.expectedCondition(expected))
                    .expressionAttributeNames(PositionExpressions.ATTRIBUTE_NAMES)
                    .expressionAttributeValues(
                        PositionExpressions.clearCellValues(expected, zone, state, System.currentTimeMillis()))
                    .returnValues(ReturnValue.ALL_NEW)
                    .build();

                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                logger.debug("Venue {} released {}, now {} in {}", expected.getVenueId(), describe(expected), state, zone);
                return venueSchema.mapToItem(response.attributes());

            } catch (ConditionalCheckFailedException e) {
                logger.warn("Venue {} moved since it was read, expected {}", expected.getVenueId(), describe(expected));
                throw new PlacementConflictException(
                    "Venue " + expected.getVenueId() + " changed position concurrently", e);
            } catch (DynamoDbException | SdkClientException e) {
                logger.error("Failed to clear cell of venue {}", expected.getVenueId(), e);
                throw new RepositoryException("Failed to clear venue position", e);
            }
        });
    }

    private static String describe(Venue venue) {
        return venue.getCell().map(GridCell::toString).orElse(venue.getZone() + "(no cell)");
    }
}
