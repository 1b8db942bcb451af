package com.nightlifemap.directory.repository.impl;

import com.nightlifemap.directory.exception.RepositoryException;
import com.nightlifemap.directory.repository.VenueOwnerRepository;
import com.nightlifemap.directory.util.DirectoryKeyFactory;
import com.nightlifemap.directory.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;

import java.util.Map;

@Repository
public class VenueOwnerRepositoryImpl implements VenueOwnerRepository {

    private static final Logger logger = LoggerFactory.getLogger(VenueOwnerRepositoryImpl.class);
    private static final String TABLE_NAME = DirectoryKeyFactory.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public VenueOwnerRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
    }

    @Override
    public boolean isOwner(String venueId, String userId) {
        if (userId == null || userId.isBlank()) {
            return false;
        }

        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(DirectoryKeyFactory.getVenuePk(venueId)).build(),
                        "sk", AttributeValue.builder().s(DirectoryKeyFactory.getOwnerSk(userId)).build()
                    ))
                    .projectionExpression("pk")
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                return response.hasItem() && !response.item().isEmpty();

            } catch (DynamoDbException | SdkClientException e) {
                logger.error("Failed to check ownership of venue {} for user {}", venueId, userId, e);
                throw new RepositoryException("Failed to check venue ownership", e);
            }
        });
    }
}
