package com.infomedia.abacox.storemigration.component.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.component.staging.StagingRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A staged customer with its orders and subscriptions, migrated as one logical unit.
 */
@Data
@Builder
@AllArgsConstructor
public class MigrationUnit {
    private long customerId;
    private ObjectNode customer;
    private List<StagingRecord> orders;
    /**
     * Staged subscriptions owned by the customer. They are not pushed; the target only receives
     * the summary metafield built from the customer payload.
     */
    @Builder.Default
    private List<StagingRecord> subscriptions = List.of();

    public String getEmail() {
        return customer.path("email").asText("unknown");
    }
}
