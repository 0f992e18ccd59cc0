package com.infomedia.abacox.storemigration.component.migration;

import com.infomedia.abacox.storemigration.db.entity.MigrationStatus;
import com.infomedia.abacox.storemigration.db.repository.CustomerMigrationRepository;
import com.infomedia.abacox.storemigration.db.repository.OrderMigrationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class MigrationOutcomeRecorderTest {

    private final CustomerMigrationRepository customerRepository = mock(CustomerMigrationRepository.class);
    private final OrderMigrationRepository orderRepository = mock(OrderMigrationRepository.class);
    private final MigrationTrackingCapability capability = mock(MigrationTrackingCapability.class);
    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
    private final TransactionStatus transaction = new SimpleTransactionStatus();
    private final MigrationOutcomeRecorder recorder =
            new MigrationOutcomeRecorder(customerRepository, orderRepository, capability, transactionManager);

    @BeforeEach
    void setUp() {
        when(capability.isAvailable()).thenReturn(true);
        when(transactionManager.getTransaction(any())).thenReturn(transaction);
    }

    @Test
    void customerAndOrderRowsCommitInOneTransaction() {
        recorder.record(outcome());

        verify(transactionManager, times(1)).getTransaction(any());
        verify(customerRepository).save(any());
        verify(orderRepository).saveAll(anyList());
        verify(transactionManager).commit(transaction);
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void failedOrderWriteRollsBackTheCustomerRow() {
        when(orderRepository.saveAll(anyList())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatCode(() -> recorder.record(outcome())).doesNotThrowAnyException();

        verify(customerRepository).save(any());
        verify(transactionManager).rollback(transaction);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void nothingIsWrittenWithoutTracking() {
        when(capability.isAvailable()).thenReturn(false);

        recorder.record(outcome());

        verifyNoInteractions(customerRepository, orderRepository, transactionManager);
    }

    private static UnitOutcome outcome() {
        return UnitOutcome.builder()
                .customerId(7L)
                .status(MigrationStatus.SUCCESS)
                .targetCustomerId(700L)
                .orders(List.of(OrderOutcome.builder().sourceOrderId(71L).targetOrderId(710L)
                        .status(MigrationStatus.SUCCESS).build()))
                .build();
    }
}
