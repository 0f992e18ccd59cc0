package com.infomedia.abacox.storemigration.component.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.component.mapping.TargetRecordMapper;
import com.infomedia.abacox.storemigration.component.staging.StagingRecord;
import com.infomedia.abacox.storemigration.component.targetapi.TargetApi;
import com.infomedia.abacox.storemigration.db.entity.MigrationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pushes one migration unit to the target platform.
 * <p>
 * The customer is created first; without it the unit fails. Orders are then created one by one
 * and a failing order is recorded and skipped. Tagging and the subscription summary never fail
 * the unit.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class CustomerMigrationExecutor {

    private final TargetApi targetApi;
    private final TargetRecordMapper mapper;

    @Value("${store-migration.migration.migrated-tag:store-migrated}")
    private String migratedTag = "store-migrated";

    public UnitOutcome migrate(MigrationUnit unit, boolean dryRun) {
        return dryRun ? simulate(unit) : push(unit);
    }

    private UnitOutcome simulate(MigrationUnit unit) {
        mapper.mapCustomer(unit.getCustomer());
        List<OrderOutcome> orders = new ArrayList<>();
        for (StagingRecord order : unit.getOrders()) {
            mapper.mapOrder(order.getPayload(), null);
            orders.add(OrderOutcome.builder()
                    .sourceOrderId(order.getNaturalId())
                    .status(MigrationStatus.PENDING)
                    .build());
        }
        boolean summary = mapper.mapSubscriptionSummary(unit.getCustomer()).isPresent();
        log.info("[DRY RUN] Would migrate customer {} ({}) with {} orders ({} staged subscriptions){}",
                unit.getEmail(), unit.getCustomerId(), orders.size(), unit.getSubscriptions().size(),
                summary ? " and a subscription summary" : "");
        return UnitOutcome.builder()
                .customerId(unit.getCustomerId())
                .email(unit.getEmail())
                .status(MigrationStatus.SUCCESS)
                .dryRun(true)
                .subscriptionSummaryAttached(summary)
                .orders(orders)
                .build();
    }

    private UnitOutcome push(MigrationUnit unit) {
        log.info("Migrating customer {} ({})", unit.getEmail(), unit.getCustomerId());

        long targetCustomerId;
        try {
            ObjectNode created = targetApi.createCustomer(mapper.mapCustomer(unit.getCustomer()));
            JsonNode id = created.get("id");
            if (id == null || !id.canConvertToLong()) {
                return UnitOutcome.failed(unit.getCustomerId(), unit.getEmail(),
                        "Target customer response carries no id", false);
            }
            targetCustomerId = id.asLong();
        } catch (RuntimeException e) {
            log.error("Failed to create target customer for {} ({}): {}", unit.getEmail(),
                    unit.getCustomerId(), e.getMessage());
            return UnitOutcome.failed(unit.getCustomerId(), unit.getEmail(), e.getMessage(), false);
        }

        List<OrderOutcome> orders = new ArrayList<>();
        for (StagingRecord order : unit.getOrders()) {
            orders.add(pushOrder(unit, order, targetCustomerId));
        }

        boolean tagged = false;
        try {
            targetApi.addCustomerTags(targetCustomerId, List.of(migratedTag));
            tagged = true;
        } catch (RuntimeException e) {
            log.warn("Failed to tag target customer {}: {}", targetCustomerId, e.getMessage());
        }

        boolean summaryAttached = false;
        Optional<ObjectNode> summary = Optional.empty();
        try {
            summary = mapper.mapSubscriptionSummary(unit.getCustomer());
            if (summary.isPresent()) {
                targetApi.createCustomerMetafield(targetCustomerId, summary.get());
                summaryAttached = true;
            }
        } catch (RuntimeException e) {
            log.warn("Failed to attach subscription summary to target customer {}: {}", targetCustomerId, e.getMessage());
        }

        UnitOutcome outcome = UnitOutcome.builder()
                .customerId(unit.getCustomerId())
                .email(unit.getEmail())
                .status(MigrationStatus.SUCCESS)
                .targetCustomerId(targetCustomerId)
                .tagged(tagged)
                .subscriptionSummaryAttached(summaryAttached)
                .orders(orders)
                .build();
        log.info("Migrated customer {}: {}/{} orders, {}", unit.getEmail(), outcome.getOrdersMigrated(),
                orders.size(), summary.isPresent() ? "with subscription data" : "no subscription data");
        return outcome;
    }

    private OrderOutcome pushOrder(MigrationUnit unit, StagingRecord order, long targetCustomerId) {
        try {
            ObjectNode created = targetApi.createOrder(mapper.mapOrder(order.getPayload(), targetCustomerId));
            JsonNode id = created.get("id");
            return OrderOutcome.builder()
                    .sourceOrderId(order.getNaturalId())
                    .targetOrderId(id != null && id.canConvertToLong() ? id.asLong() : null)
                    .status(MigrationStatus.SUCCESS)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Failed to create order {} for customer {}: {}", order.getNaturalId(), unit.getEmail(), e.getMessage());
            return OrderOutcome.builder()
                    .sourceOrderId(order.getNaturalId())
                    .status(MigrationStatus.FAILED)
                    .error(e.getMessage())
                    .build();
        }
    }
}
