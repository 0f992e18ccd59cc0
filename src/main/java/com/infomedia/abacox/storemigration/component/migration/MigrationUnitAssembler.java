package com.infomedia.abacox.storemigration.component.migration;

import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.component.staging.StagingRecord;
import com.infomedia.abacox.storemigration.component.staging.StagingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@Log4j2
@RequiredArgsConstructor
public class MigrationUnitAssembler {

    private final StagingStore stagingStore;

    /**
     * Reads a customer with its orders and subscriptions from staging.
     *
     * @return empty when the customer is not staged
     * @throws com.infomedia.abacox.storemigration.component.staging.CorruptPayloadException when a
     *         stored payload does not decode
     */
    public Optional<MigrationUnit> assemble(long customerId) {
        Optional<StagingRecord> customer = stagingStore.findRecord(EntityKind.CUSTOMER, customerId);
        if (customer.isEmpty()) {
            log.warn("Customer {} not found in staging", customerId);
            return Optional.empty();
        }
        List<StagingRecord> orders = stagingStore.getByOwner(EntityKind.ORDER, customerId);
        List<StagingRecord> subscriptions = stagingStore.getByOwner(EntityKind.SUBSCRIPTION, customerId);
        log.debug("Assembled customer {} with {} orders and {} subscriptions", customerId, orders.size(),
                subscriptions.size());
        return Optional.of(MigrationUnit.builder()
                .customerId(customerId)
                .customer(customer.get().getPayload())
                .orders(orders)
                .subscriptions(subscriptions)
                .build());
    }
}
