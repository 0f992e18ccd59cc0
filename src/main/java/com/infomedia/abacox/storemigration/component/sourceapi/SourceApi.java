package com.infomedia.abacox.storemigration.component.sourceapi;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.dto.connection.ConnectionTestResult;

import java.util.Optional;

/**
 * Read-only access to the source commerce platform. Every call acquires a rate limiter permit.
 */
public interface SourceApi {

    /**
     * @throws com.infomedia.abacox.storemigration.exception.SourceApiException on transport or HTTP failure
     */
    SourcePage fetchPage(EntityKind kind, int page, int pageSize);

    /**
     * @return the record, or empty when the source answers 404
     */
    Optional<ObjectNode> fetchRecord(EntityKind kind, long naturalId);

    /**
     * Total record count the source reports for a kind, read from a one-record page.
     */
    Optional<Long> fetchTotalCount(EntityKind kind);

    ConnectionTestResult testConnection();
}
