package com.infomedia.abacox.storemigration.component.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.component.targetapi.TargetApi;
import com.infomedia.abacox.storemigration.exception.TargetApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SKU index over the target product catalogue, used to link migrated order lines to existing
 * target variants. Loaded once per migration run.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class ProductCatalog {

    static final int PAGE_LIMIT = 250;

    private final TargetApi targetApi;

    private volatile Map<String, ProductVariantRef> bySku;

    /**
     * Reloads the catalogue. A failed fetch keeps whatever pages were already read.
     *
     * @return number of indexed SKUs
     */
    public synchronized int refresh() {
        Map<String, ProductVariantRef> index = new HashMap<>();
        Long sinceId = null;
        int products = 0;
        try {
            while (true) {
                List<ObjectNode> page = targetApi.fetchProducts(sinceId, PAGE_LIMIT);
                if (page.isEmpty()) {
                    break;
                }
                for (ObjectNode product : page) {
                    products++;
                    index(product, index);
                }
                if (page.size() < PAGE_LIMIT) {
                    break;
                }
                sinceId = page.get(page.size() - 1).path("id").asLong();
            }
        } catch (TargetApiException e) {
            log.warn("Failed to build product catalogue, continuing with {} SKUs: {}", index.size(), e.getMessage());
        }
        bySku = index;
        log.info("Built product catalogue for {} SKUs from {} products", index.size(), products);
        return index.size();
    }

    public Optional<ProductVariantRef> findBySku(String sku) {
        if (sku == null || sku.isBlank()) {
            return Optional.empty();
        }
        Map<String, ProductVariantRef> index = bySku;
        if (index == null) {
            refresh();
            index = bySku;
        }
        return Optional.ofNullable(index.get(sku.trim()));
    }

    public int size() {
        Map<String, ProductVariantRef> index = bySku;
        return index == null ? 0 : index.size();
    }

    private static void index(ObjectNode product, Map<String, ProductVariantRef> index) {
        JsonNode variants = product.path("variants");
        if (!variants.isArray()) {
            return;
        }
        for (JsonNode variant : variants) {
            String sku = variant.path("sku").asText("").trim();
            if (sku.isEmpty()) {
                continue;
            }
            index.put(sku, ProductVariantRef.builder()
                    .productId(product.path("id").isNumber() ? product.path("id").asLong() : null)
                    .variantId(variant.path("id").isNumber() ? variant.path("id").asLong() : null)
                    .title(product.path("title").asText(""))
                    .variantTitle(variant.path("title").asText(""))
                    .price(variant.path("price").asText("0.00"))
                    .build());
        }
    }
}
