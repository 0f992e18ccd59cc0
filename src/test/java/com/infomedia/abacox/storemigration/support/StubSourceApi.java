package com.infomedia.abacox.storemigration.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.component.sourceapi.SourceApi;
import com.infomedia.abacox.storemigration.component.sourceapi.SourcePage;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.dto.connection.ConnectionTestResult;
import com.infomedia.abacox.storemigration.exception.SourceApiException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Scripted source API. Pages that were not scripted come back empty.
 */
public class StubSourceApi implements SourceApi {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<Integer, SourcePage> pages = new HashMap<>();
    private final Set<Integer> failingPages = new HashSet<>();
    private final List<Integer> requestedPages = new ArrayList<>();
    private boolean failEverything;

    public StubSourceApi page(int page, List<JsonNode> results, String next) {
        pages.put(page, SourcePage.builder().results(results).next(next).build());
        return this;
    }

    /**
     * Scripts a page of customers with consecutive ids and a next link to {@code page + 1}.
     */
    public StubSourceApi customerPage(int page, long firstId, int size) {
        List<JsonNode> results = LongStream.range(firstId, firstId + size)
                .mapToObj(StubSourceApi::customer)
                .collect(Collectors.toList());
        return page(page, results, "https://source.example.com/v1/customers/?limit=" + size + "&page=" + (page + 1));
    }

    public StubSourceApi failPage(int page) {
        failingPages.add(page);
        return this;
    }

    public StubSourceApi failEverything() {
        this.failEverything = true;
        return this;
    }

    public List<Integer> getRequestedPages() {
        return requestedPages;
    }

    public static ObjectNode customer(long id) {
        return MAPPER.createObjectNode().put("id", id).put("email", "customer" + id + "@example.com");
    }

    @Override
    public SourcePage fetchPage(EntityKind kind, int page, int pageSize) {
        requestedPages.add(page);
        if (failEverything || failingPages.contains(page)) {
            throw new SourceApiException("HTTP Error: 500 on page " + page);
        }
        return pages.getOrDefault(page, SourcePage.builder().results(List.of()).build());
    }

    @Override
    public Optional<ObjectNode> fetchRecord(EntityKind kind, long naturalId) {
        return pages.values().stream()
                .flatMap(p -> p.getResults().stream())
                .filter(node -> node.path("id").asLong() == naturalId)
                .map(node -> (ObjectNode) node)
                .findFirst();
    }

    @Override
    public Optional<Long> fetchTotalCount(EntityKind kind) {
        return Optional.of(pages.values().stream().mapToLong(p -> p.getResults().size()).sum());
    }

    @Override
    public ConnectionTestResult testConnection() {
        return ConnectionTestResult.ok("source", null);
    }
}
