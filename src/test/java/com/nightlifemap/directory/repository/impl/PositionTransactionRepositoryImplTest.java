package com.nightlifemap.directory.repository.impl;

import com.nightlifemap.directory.exception.PlacementConflictException;
import com.nightlifemap.directory.exception.TransactionFailedException;
import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.testutil.VenueTestBuilder;
import com.nightlifemap.directory.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PositionTransactionRepositoryImplTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private PositionTransactionRepositoryImpl repository;

    private Venue source;
    private Venue target;

    @BeforeEach
    void setUp() {
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            java.util.function.Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });

        repository = new PositionTransactionRepositoryImpl(dynamoDbClient, performanceTracker);
        source = VenueTestBuilder.aVenue().at("soi6", 1, 1).build();
        target = VenueTestBuilder.aVenue().at("soi7", 2, 3).build();
    }

    @Test
    void exchangePositions_WritesBothVenuesInOneTransaction() {
        // Given
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenReturn(TransactWriteItemsResponse.builder().build());

        // When
        repository.exchangePositions(source, new GridCell("soi7", 2, 3), target, new GridCell("soi6", 1, 1));

        // Then
        ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(dynamoDbClient).transactWriteItems(captor.capture());
        TransactWriteItemsRequest request = captor.getValue();
        assertThat(request.transactItems()).hasSize(2);

        Update sourceUpdate = request.transactItems().get(0).update();
        assertThat(sourceUpdate.key().get("pk").s()).isEqualTo("VENUE#" + source.getVenueId());
        assertThat(sourceUpdate.conditionExpression()).isEqualTo(PositionExpressions.EXPECT_PLACED);
        assertThat(sourceUpdate.expressionAttributeValues().get(":expZone").s()).isEqualTo("soi6");
        assertThat(sourceUpdate.expressionAttributeValues().get(":gsi1sk").s()).isEqualTo("CELL#002#003");

        Update targetUpdate = request.transactItems().get(1).update();
        assertThat(targetUpdate.key().get("pk").s()).isEqualTo("VENUE#" + target.getVenueId());
        assertThat(targetUpdate.expressionAttributeValues().get(":expZone").s()).isEqualTo("soi7");
        assertThat(targetUpdate.expressionAttributeValues().get(":zone").s()).isEqualTo("soi6");
    }

    @Test
    void exchangePositions_ConditionCheckFailed_ThrowsConflict() {
        TransactionCanceledException cancelled = TransactionCanceledException.builder()
            .message("Transaction cancelled")
            .cancellationReasons(
                CancellationReason.builder().code("None").build(),
                CancellationReason.builder().code("ConditionalCheckFailed").build())
            .build();
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class))).thenThrow(cancelled);

        assertThatThrownBy(() -> repository.exchangePositions(
                source, new GridCell("soi7", 2, 3), target, new GridCell("soi6", 1, 1)))
            .isInstanceOf(PlacementConflictException.class);
    }

    @Test
    void exchangePositions_OtherCancellation_ThrowsTransactionFailed() {
        TransactionCanceledException cancelled = TransactionCanceledException.builder()
            .message("Transaction cancelled")
            .cancellationReasons(CancellationReason.builder().code("TransactionConflict").build())
            .build();
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class))).thenThrow(cancelled);

        assertThatThrownBy(() -> repository.exchangePositions(
                source, new GridCell("soi7", 2, 3), target, new GridCell("soi6", 1, 1)))
            .isInstanceOf(TransactionFailedException.class);
    }

    @Test
    void exchangePositions_ClientError_ThrowsTransactionFailed() {
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenThrow(SdkClientException.create("Connection reset"));

        assertThatThrownBy(() -> repository.exchangePositions(
                source, new GridCell("soi7", 2, 3), target, new GridCell("soi6", 1, 1)))
            .isInstanceOf(TransactionFailedException.class)
            .hasMessageContaining("unavailable");
    }
}
