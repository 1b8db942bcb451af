package com.nightlifemap.directory.config;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DynamoDBConfigTest {

    private DynamoDBConfig config(String region, String endpoint) {
        DynamoDBConfig config = new DynamoDBConfig();
        ReflectionTestUtils.setField(config, "region", region);
        ReflectionTestUtils.setField(config, "endpoint", endpoint);
        ReflectionTestUtils.setField(config, "apiCallTimeout", Duration.ofSeconds(5));
        return config;
    }

    @Test
    void dynamoDbClient_WithDefaultRegion_ShouldCreateClient() {
        DynamoDbClient client = config("us-east-1", "").dynamoDbClient();

        assertNotNull(client);
    }

    @Test
    void dynamoDbClient_WithLocalEndpoint_ShouldCreateClientWithEndpointOverride() {
        DynamoDbClient client = config("ap-southeast-1", "http://localhost:8000").dynamoDbClient();

        assertNotNull(client);
    }

    @Test
    void dynamoDbEnhancedClient_ShouldCreateEnhancedClient() {
        DynamoDbClient mockClient = mock(DynamoDbClient.class);

        DynamoDbEnhancedClient enhancedClient = config("us-east-1", "").dynamoDbEnhancedClient(mockClient);

        assertNotNull(enhancedClient);
    }
}
