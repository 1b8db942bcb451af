package com.nightlifemap.directory.config;

import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.util.DirectoryKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

/**
 * Creates the DirectoryTable with its ZoneCellIndex GSI when running against a fresh
 * (usually local) DynamoDB, and turns on TTL for placement leases.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);
    private static final String TTL_ATTRIBUTE = "expiresAt";

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final DynamoDbClient dynamoDbClient;

    @Autowired
    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient, DynamoDbClient dynamoDbClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(DirectoryKeyFactory.TABLE_NAME);
        configureTTL(DirectoryKeyFactory.TABLE_NAME, TTL_ATTRIBUTE);
    }

    private void createTableIfNotExists(String tableName) {
        DynamoDbTable<Venue> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(Venue.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);

        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(createGSI(DirectoryKeyFactory.ZONE_CELL_INDEX))
                .build());
            logger.info("Table {} created successfully with GSIs", tableName);
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }

    private void configureTTL(String tableName, String ttlAttributeName) {
        try {
            logger.info("Configuring TTL for table {} on attribute {}", tableName, ttlAttributeName);
            dynamoDbClient.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                .tableName(tableName)
                .timeToLiveSpecification(TimeToLiveSpecification.builder()
                    .attributeName(ttlAttributeName)
                    .enabled(true)
                    .build())
                .build());

        } catch (DynamoDbException e) {
            // Already enabled, or not supported by the local emulator
            logger.warn("Could not configure TTL for table {} on attribute {}: {}",
                tableName, ttlAttributeName, e.getMessage());
        }
    }
}
