package com.infomedia.abacox.storemigration.component.mapping;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Translates staged source payloads into target request bodies (without the root key).
 */
public interface TargetRecordMapper {

    ObjectNode mapCustomer(ObjectNode sourceCustomer);

    /**
     * @param targetCustomerId id of the already created target customer; null in dry runs
     */
    ObjectNode mapOrder(ObjectNode sourceOrder, Long targetCustomerId);

    /**
     * Metafield summarizing the customer's subscription history, or empty when the customer has
     * no subscription status other than "none".
     */
    Optional<ObjectNode> mapSubscriptionSummary(ObjectNode sourceCustomer);
}
