package com.nightlifemap.directory.repository.impl;

import com.nightlifemap.directory.exception.RepositoryException;
import com.nightlifemap.directory.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VenueOwnerRepositoryImplTest {

    private static final String VENUE_ID = "12345678-1234-1234-1234-123456789abc";
    private static final String USER_ID = "user-42";

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private VenueOwnerRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            java.util.function.Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });

        repository = new VenueOwnerRepositoryImpl(dynamoDbClient, performanceTracker);
    }

    @Test
    void isOwner_OwnerRecordExists_ReturnsTrue() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder()
            .item(Map.of("pk", AttributeValue.builder().s("VENUE#" + VENUE_ID).build()))
            .build());

        assertThat(repository.isOwner(VENUE_ID, USER_ID)).isTrue();

        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDbClient).getItem(captor.capture());
        assertThat(captor.getValue().key().get("sk").s()).isEqualTo("OWNER#" + USER_ID);
    }

    @Test
    void isOwner_NoRecord_ReturnsFalse() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        assertThat(repository.isOwner(VENUE_ID, USER_ID)).isFalse();
    }

    @Test
    void isOwner_BlankUser_ReturnsFalseWithoutLookup() {
        assertThat(repository.isOwner(VENUE_ID, " ")).isFalse();
        verifyNoInteractions(dynamoDbClient);
    }

    @Test
    void isOwner_ServiceError_ThrowsRepositoryException() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
            .thenThrow(DynamoDbException.builder().message("Throttled").build());

        assertThatThrownBy(() -> repository.isOwner(VENUE_ID, USER_ID))
            .isInstanceOf(RepositoryException.class);
    }
}
