package com.infomedia.abacox.storemigration.component.migration;

import com.infomedia.abacox.storemigration.db.entity.CustomerMigration;
import com.infomedia.abacox.storemigration.db.entity.MigrationStatus;
import com.infomedia.abacox.storemigration.db.entity.OrderMigration;
import com.infomedia.abacox.storemigration.db.repository.CustomerMigrationRepository;
import com.infomedia.abacox.storemigration.db.repository.OrderMigrationRepository;
import com.infomedia.abacox.storemigration.db.util.InClauseChunker;
import com.infomedia.abacox.storemigration.dto.migration.MigrationStats;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Persists unit and order outcomes so a later run can skip what already succeeded. When outcome
 * tracking is unavailable every operation degrades to logging.
 */
@Component
@Log4j2
public class MigrationOutcomeRecorder {

    private final CustomerMigrationRepository customerMigrationRepository;
    private final OrderMigrationRepository orderMigrationRepository;
    private final MigrationTrackingCapability trackingCapability;
    private final TransactionTemplate transactionTemplate;

    public MigrationOutcomeRecorder(CustomerMigrationRepository customerMigrationRepository,
                                    OrderMigrationRepository orderMigrationRepository,
                                    MigrationTrackingCapability trackingCapability,
                                    PlatformTransactionManager transactionManager) {
        this.customerMigrationRepository = customerMigrationRepository;
        this.orderMigrationRepository = orderMigrationRepository;
        this.trackingCapability = trackingCapability;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Stores an outcome. The customer row and its order rows commit together or not at all.
     * A storage failure is logged and does not affect the run.
     */
    public void record(UnitOutcome outcome) {
        if (!trackingCapability.isAvailable()) {
            log.info("Customer {} migration outcome: {}{}", outcome.getCustomerId(), outcome.getStatus(),
                    outcome.getError() != null ? " (" + outcome.getError() + ")" : "");
            return;
        }
        LocalDateTime now = LocalDateTime.now();
        CustomerMigration customer = CustomerMigration.builder()
                .naturalId(outcome.getCustomerId())
                .targetId(outcome.getTargetCustomerId())
                .status(outcome.getStatus())
                .errorDetail(outcome.getError())
                .ordersMigrated(outcome.getOrdersMigrated())
                .ordersFailed(outcome.getOrdersFailed())
                .updatedAt(now)
                .build();
        List<OrderMigration> orders = outcome.getOrders().stream()
                .map(order -> OrderMigration.builder()
                        .naturalId(order.getSourceOrderId())
                        .customerNaturalId(outcome.getCustomerId())
                        .targetId(order.getTargetOrderId())
                        .status(order.getStatus())
                        .errorDetail(order.getError())
                        .updatedAt(now)
                        .build())
                .collect(Collectors.toList());
        try {
            transactionTemplate.executeWithoutResult(status -> {
                customerMigrationRepository.save(customer);
                orderMigrationRepository.saveAll(orders);
            });
        } catch (RuntimeException e) {
            log.error("Could not record migration outcome for customer {}: {}", outcome.getCustomerId(), e.getMessage(), e);
        }
    }

    /**
     * The subset of {@code customerIds} already migrated successfully.
     */
    @Transactional(readOnly = true)
    public Set<Long> findMigratedCustomerIds(Collection<Long> customerIds) {
        if (!trackingCapability.isAvailable()) {
            return Set.of();
        }
        return new HashSet<>(InClauseChunker.<Long>queryInChunks(customerIds, InClauseChunker.DEFAULT_CHUNK_SIZE,
                chunk -> customerMigrationRepository.findNaturalIdsByStatusIn(MigrationStatus.SUCCESS, chunk)));
    }

    @Transactional(readOnly = true)
    public MigrationStats getStats() {
        if (!trackingCapability.isAvailable()) {
            return MigrationStats.builder().trackingAvailable(false).build();
        }
        return MigrationStats.builder()
                .trackingAvailable(true)
                .customersSucceeded(customerMigrationRepository.countByStatus(MigrationStatus.SUCCESS))
                .customersFailed(customerMigrationRepository.countByStatus(MigrationStatus.FAILED))
                .customersPending(customerMigrationRepository.countByStatus(MigrationStatus.PENDING))
                .ordersSucceeded(orderMigrationRepository.countByStatus(MigrationStatus.SUCCESS))
                .ordersFailed(orderMigrationRepository.countByStatus(MigrationStatus.FAILED))
                .build();
    }

    /**
     * Forgets every recorded outcome so that the next run migrates all eligible customers again.
     *
     * @return number of customer outcomes removed
     */
    @Transactional
    public long resetStatuses() {
        if (!trackingCapability.isAvailable()) {
            return 0;
        }
        long removed = customerMigrationRepository.count();
        orderMigrationRepository.deleteAllInBatch();
        customerMigrationRepository.deleteAllInBatch();
        log.warn("Reset {} recorded customer migration outcomes", removed);
        return removed;
    }
}
