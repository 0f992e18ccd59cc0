package com.infomedia.abacox.storemigration.component.sourceapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.component.easyhttp.EasyHttpClient;
import com.infomedia.abacox.storemigration.component.easyhttp.EasyHttpException;
import com.infomedia.abacox.storemigration.component.ratelimit.RateLimitedCall;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.dto.connection.ConnectionTestResult;
import com.infomedia.abacox.storemigration.exception.SourceApiException;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Log4j2
public class SourceApiClient implements SourceApi {

    private static final String API_NAME = "source";

    private final EasyHttpClient httpClient;
    private final RateLimitedCall rateLimitedCall;

    public SourceApiClient(EasyHttpClient httpClient, RateLimitedCall rateLimitedCall) {
        this.httpClient = httpClient;
        this.rateLimitedCall = rateLimitedCall;
    }

    @Override
    public SourcePage fetchPage(EntityKind kind, int page, int pageSize) {
        String description = "GET " + kind.getEndpoint() + " page " + page;
        JsonNode body;
        try {
            body = rateLimitedCall.execute(description, () -> httpClient.path(kind.getEndpoint())
                    .queryParam("page", page)
                    .queryParam("limit", pageSize)
                    .get()
                    .asJsonNode());
        } catch (EasyHttpException e) {
            throw new SourceApiException("Failed to fetch " + description + ": " + e.getMessage(), e);
        }

        List<JsonNode> results = new ArrayList<>();
        JsonNode resultsNode = body.get("results");
        if (resultsNode != null && resultsNode.isArray()) {
            resultsNode.forEach(results::add);
        }
        JsonNode next = body.get("next");
        JsonNode count = body.get("count");
        log.debug("Fetched {} {} records (page: {}, limit: {})", results.size(), kind, page, pageSize);
        return SourcePage.builder()
                .results(results)
                .next(next == null || next.isNull() ? null : next.asText())
                .count(count != null && count.canConvertToLong() ? count.asLong() : null)
                .build();
    }

    @Override
    public Optional<ObjectNode> fetchRecord(EntityKind kind, long naturalId) {
        String path = kind.getEndpoint() + naturalId + "/";
        try {
            return Optional.of(rateLimitedCall.execute("GET " + path,
                    () -> httpClient.path(path).get().asObjectNode()));
        } catch (EasyHttpException e) {
            if (e.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw new SourceApiException("Failed to fetch " + kind + " " + naturalId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Long> fetchTotalCount(EntityKind kind) {
        return Optional.ofNullable(fetchPage(kind, 0, 1).getCount());
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            fetchPage(EntityKind.CUSTOMER, 0, 1);
            return ConnectionTestResult.ok(API_NAME, null);
        } catch (SourceApiException e) {
            log.warn("Source API connection test failed: {}", e.getMessage());
            return ConnectionTestResult.failed(API_NAME, e.getMessage());
        }
    }
}
