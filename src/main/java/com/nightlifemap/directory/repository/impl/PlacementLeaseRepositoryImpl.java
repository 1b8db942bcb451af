package com.nightlifemap.directory.repository.impl;

import com.nightlifemap.directory.exception.RepositoryException;
import com.nightlifemap.directory.repository.PlacementLeaseRepository;
import com.nightlifemap.directory.util.DirectoryKeyFactory;
import com.nightlifemap.directory.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.Map;

/**
 * Lease items live at {@code LEASE#{venueId}} / {@code METADATA}.
 * {@code expiresAt} is epoch seconds so the table's TTL sweeps abandoned leases;
 * until the sweep runs the acquire condition treats an expired lease as free.
 */
@Repository
public class PlacementLeaseRepositoryImpl implements PlacementLeaseRepository {

    private static final Logger logger = LoggerFactory.getLogger(PlacementLeaseRepositoryImpl.class);
    private static final String TABLE_NAME = DirectoryKeyFactory.TABLE_NAME;
    private static final String LEASE_ITEM_TYPE = "LEASE";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public PlacementLeaseRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
    }

    @Override
    public boolean tryAcquire(String venueId, String ownerToken, Instant expiresAt) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                PutItemRequest request = PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(Map.of(
                        "pk", AttributeValue.builder().s(DirectoryKeyFactory.getLeasePk(venueId)).build(),
                        "sk", AttributeValue.builder().s(DirectoryKeyFactory.getMetadataSk()).build(),
                        "itemType", AttributeValue.builder().s(LEASE_ITEM_TYPE).build(),
                        "ownerToken", AttributeValue.builder().s(ownerToken).build(),
                        "expiresAt", AttributeValue.builder().n(String.valueOf(expiresAt.getEpochSecond())).build()
                    ))
                    .conditionExpression("attribute_not_exists(pk) OR expiresAt < :now")
                    .expressionAttributeValues(Map.of(
                        ":now", AttributeValue.builder().n(String.valueOf(Instant.now().getEpochSecond())).build()
                    ))
                    .build();

                dynamoDbClient.putItem(request);
                logger.debug("Lease on venue {} taken until {}", venueId, expiresAt);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Lease on venue {} is held by another placement", venueId);
                return false;
            } catch (DynamoDbException | SdkClientException e) {
                logger.error("Failed to acquire lease on venue {}", venueId, e);
                throw new RepositoryException("Failed to acquire placement lease", e);
            }
        });
    }

    @Override
    public void release(String venueId, String ownerToken) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                DeleteItemRequest request = DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(DirectoryKeyFactory.getLeasePk(venueId)).build(),
                        "sk", AttributeValue.builder().s(DirectoryKeyFactory.getMetadataSk()).build()
                    ))
                    .conditionExpression("ownerToken = :token")
                    .expressionAttributeValues(Map.of(
                        ":token", AttributeValue.builder().s(ownerToken).build()
                    ))
                    .build();

                dynamoDbClient.deleteItem(request);
                logger.debug("Lease on venue {} released", venueId);

            } catch (ConditionalCheckFailedException e) {
                // Expired and taken over, or already swept
                logger.info("Lease on venue {} no longer held by {}", venueId, ownerToken);
            } catch (DynamoDbException | SdkClientException e) {
                logger.error("Failed to release lease on venue {}", venueId, e);
                throw new RepositoryException("Failed to release placement lease", e);
            }
            return null;
        });
    }
}
