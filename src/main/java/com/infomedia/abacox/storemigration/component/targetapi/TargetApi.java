package com.infomedia.abacox.storemigration.component.targetapi;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.dto.connection.ConnectionTestResult;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Write access to the target commerce platform. Request and response bodies are wrapped in a
 * root key ({@code {"customer": {...}}}); implementations wrap and unwrap it. Failures surface
 * as {@link com.infomedia.abacox.storemigration.exception.TargetApiException}.
 */
public interface TargetApi {

    ObjectNode createCustomer(ObjectNode customer);

    ObjectNode updateCustomer(long customerId, ObjectNode customer);

    Optional<ObjectNode> getCustomer(long customerId);

    /**
     * Adds tags to a customer, keeping the ones it already carries.
     */
    ObjectNode addCustomerTags(long customerId, Collection<String> tags);

    ObjectNode createOrder(ObjectNode order);

    ObjectNode createCustomerMetafield(long customerId, ObjectNode metafield);

    /**
     * One page of the product catalogue, ordered by id.
     *
     * @param sinceId only products with a greater id; null for the first page
     */
    List<ObjectNode> fetchProducts(Long sinceId, int limit);

    ConnectionTestResult testConnection();
}
