package com.nightlifemap.directory.service;

import com.nightlifemap.directory.config.GridProperties;
import com.nightlifemap.directory.exception.PlacementConflictException;
import com.nightlifemap.directory.exception.TransactionFailedException;
import com.nightlifemap.directory.model.GridCell;
import com.nightlifemap.directory.model.Venue;
import com.nightlifemap.directory.repository.PositionTransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.nightlifemap.directory.testutil.VenueTestBuilder.aVenue;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AtomicSwapExecutorTest {

    @Mock
    private PositionTransactionRepository transactionRepository;

    private GridProperties properties;
    private AtomicSwapExecutor executor;

    private Venue source;
    private Venue target;
    private final GridCell sourceCell = new GridCell("soi6", 1, 5);
    private final GridCell targetCell = new GridCell("soi6", 1, 6);

    @BeforeEach
    void setUp() {
        properties = new GridProperties();
        executor = new AtomicSwapExecutor(transactionRepository, properties);
        source = aVenue().at("soi6", 1, 5).build();
        target = aVenue().at("soi6", 1, 6).build();
    }

    @Test
    void trySwap_TransactionCommits_ReturnsBothVenuesInNewCells() {
        Optional<SwapResult> result = executor.trySwap(source, target, targetCell, sourceCell);

        assertThat(result).isPresent();
        assertThat(result.get().source().getCell()).contains(targetCell);
        assertThat(result.get().target().getCell()).contains(sourceCell);
        verify(transactionRepository).exchangePositions(source, targetCell, target, sourceCell);
    }

    @Test
    void trySwap_DoesNotMutateInputs() {
        executor.trySwap(source, target, targetCell, sourceCell);

        assertThat(source.getCell()).contains(sourceCell);
        assertThat(target.getCell()).contains(targetCell);
    }

    @Test
    void trySwap_TransactionFails_NotAvailable() {
        doThrow(new TransactionFailedException("Atomic exchange unavailable"))
            .when(transactionRepository).exchangePositions(any(), any(), any(), any());

        assertThat(executor.trySwap(source, target, targetCell, sourceCell)).isEmpty();
    }

    @Test
    void trySwap_ConditionFailed_ConflictPropagates() {
        doThrow(new PlacementConflictException("Venue position changed concurrently during swap"))
            .when(transactionRepository).exchangePositions(any(), any(), any(), any());

        assertThatThrownBy(() -> executor.trySwap(source, target, targetCell, sourceCell))
            .isInstanceOf(PlacementConflictException.class);
    }

    @Test
    void trySwap_Disabled_SkipsStore() {
        properties.getSwap().setAtomicEnabled(false);

        assertThat(executor.trySwap(source, target, targetCell, sourceCell)).isEmpty();
        verifyNoInteractions(transactionRepository);
    }
}
