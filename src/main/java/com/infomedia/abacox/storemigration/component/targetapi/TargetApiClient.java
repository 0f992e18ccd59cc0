package com.infomedia.abacox.storemigration.component.targetapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.component.easyhttp.EasyHttpClient;
import com.infomedia.abacox.storemigration.component.easyhttp.EasyHttpException;
import com.infomedia.abacox.storemigration.component.ratelimit.RateLimitedCall;
import com.infomedia.abacox.storemigration.dto.connection.ConnectionTestResult;
import com.infomedia.abacox.storemigration.exception.TargetApiException;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Supplier;

@Log4j2
public class TargetApiClient implements TargetApi {

    private static final String API_NAME = "target";

    private final EasyHttpClient httpClient;
    private final RateLimitedCall rateLimitedCall;
    private final ObjectMapper objectMapper;

    public TargetApiClient(EasyHttpClient httpClient, RateLimitedCall rateLimitedCall) {
        this.httpClient = httpClient;
        this.rateLimitedCall = rateLimitedCall;
        this.objectMapper = httpClient.getObjectMapper();
    }

    @Override
    public ObjectNode createCustomer(ObjectNode customer) {
        ObjectNode created = unwrap("customer", call("POST customers.json",
                () -> httpClient.path("customers.json").json(wrap("customer", customer)).post().asObjectNode()));
        log.info("Created target customer {} - {}", created.path("id").asText(), created.path("email").asText());
        return created;
    }

    @Override
    public ObjectNode updateCustomer(long customerId, ObjectNode customer) {
        String path = "customers/" + customerId + ".json";
        ObjectNode updated = unwrap("customer", call("PUT " + path,
                () -> httpClient.path(path).json(wrap("customer", customer)).put().asObjectNode()));
        log.debug("Updated target customer {}", customerId);
        return updated;
    }

    @Override
    public Optional<ObjectNode> getCustomer(long customerId) {
        String path = "customers/" + customerId + ".json";
        try {
            return Optional.of(unwrap("customer", rateLimitedCall.execute("GET " + path,
                    () -> httpClient.path(path).get().asObjectNode())));
        } catch (EasyHttpException e) {
            if (e.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw new TargetApiException("GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ObjectNode addCustomerTags(long customerId, Collection<String> tags) {
        ObjectNode current = getCustomer(customerId)
                .orElseThrow(() -> new TargetApiException("Target customer " + customerId + " does not exist"));

        TreeSet<String> merged = new TreeSet<>();
        String existing = current.path("tags").asText("");
        Arrays.stream(existing.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .forEach(merged::add);
        tags.stream().filter(Objects::nonNull).map(String::trim).filter(tag -> !tag.isEmpty()).forEach(merged::add);

        ObjectNode update = objectMapper.createObjectNode();
        update.put("id", customerId);
        update.put("tags", String.join(", ", merged));
        return updateCustomer(customerId, update);
    }

    @Override
    public ObjectNode createOrder(ObjectNode order) {
        ObjectNode created = unwrap("order", call("POST orders.json",
                () -> httpClient.path("orders.json").json(wrap("order", order)).post().asObjectNode()));
        log.info("Created target order {} - {}", created.path("id").asText(), created.path("name").asText());
        return created;
    }

    @Override
    public ObjectNode createCustomerMetafield(long customerId, ObjectNode metafield) {
        String path = "customers/" + customerId + "/metafields.json";
        ObjectNode created = unwrap("metafield", call("POST " + path,
                () -> httpClient.path(path).json(wrap("metafield", metafield)).post().asObjectNode()));
        log.debug("Created metafield {} for target customer {}", metafield.path("key").asText(), customerId);
        return created;
    }

    @Override
    public List<ObjectNode> fetchProducts(Long sinceId, int limit) {
        JsonNode body = call("GET products.json", () -> httpClient.path("products.json")
                .queryParam("limit", limit)
                .queryParam("since_id", sinceId)
                .get()
                .asJsonNode());
        List<ObjectNode> products = new ArrayList<>();
        JsonNode array = body.get("products");
        if (array != null && array.isArray()) {
            for (JsonNode product : array) {
                if (product.isObject()) {
                    products.add((ObjectNode) product);
                }
            }
        }
        return products;
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            JsonNode shop = call("GET shop.json", () -> httpClient.path("shop.json").get().asJsonNode()).path("shop");
            return ConnectionTestResult.ok(API_NAME, shop.path("name").asText(null));
        } catch (TargetApiException e) {
            log.warn("Target API connection test failed: {}", e.getMessage());
            return ConnectionTestResult.failed(API_NAME, e.getMessage());
        }
    }

    private <T> T call(String description, Supplier<T> request) {
        try {
            return rateLimitedCall.execute(description, request);
        } catch (EasyHttpException e) {
            log.error("{} failed: {}", description, e.getMessage());
            throw new TargetApiException(description + " failed: " + e.getMessage(), e);
        }
    }

    private ObjectNode wrap(String rootKey, ObjectNode body) {
        ObjectNode wrapped = objectMapper.createObjectNode();
        wrapped.set(rootKey, body);
        return wrapped;
    }

    private static ObjectNode unwrap(String rootKey, ObjectNode response) {
        JsonNode inner = response.get(rootKey);
        if (inner == null || !inner.isObject()) {
            throw new TargetApiException("Response has no '" + rootKey + "' object");
        }
        return (ObjectNode) inner;
    }
}
