package com.infomedia.abacox.storemigration.component.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * Field-for-field mapping into the target shapes. Values are copied as they are; phone, address
 * and HTML clean-up is left to the target platform.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class DefaultTargetRecordMapper implements TargetRecordMapper {

    private static final DateTimeFormatter MIGRATION_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectMapper objectMapper;
    private final ProductCatalog productCatalog;

    @Value("${store-migration.migration.metafield-namespace:store_migration}")
    private String metafieldNamespace = "store_migration";

    @Value("${store-migration.migration.import-tag:store-import}")
    private String importTag = "store-import";

    @Override
    public ObjectNode mapCustomer(ObjectNode source) {
        ObjectNode customer = objectMapper.createObjectNode();
        customer.put("email", source.path("email").asText(""));
        customer.put("first_name", source.path("first_name").asText(""));
        customer.put("last_name", source.path("last_name").asText(""));
        copyText(source, "phone", customer, "phone");
        customer.put("verified_email", true);
        customer.put("tags", importTag);
        customer.put("note", "Imported from source store. Original ID: " + source.path("id").asText());
        copyText(source, "date_created", customer, "created_at");
        copyText(source, "date_updated", customer, "updated_at");

        ArrayNode addresses = objectMapper.createArrayNode();
        address(source, "shipping_address").ifPresent(addresses::add);
        address(source, "billing_address")
                .filter(billing -> addresses.isEmpty() || !billing.equals(addresses.get(0)))
                .ifPresent(addresses::add);
        if (!addresses.isEmpty()) {
            customer.set("addresses", addresses);
        }
        if (source.path("marketing_opt_in").asBoolean(false)) {
            customer.put("accepts_marketing", true);
        }
        return customer;
    }

    @Override
    public ObjectNode mapOrder(ObjectNode source, Long targetCustomerId) {
        String currency = source.path("currency").asText("USD");
        ObjectNode order = objectMapper.createObjectNode();
        order.put("email", source.path("customer_email").asText(""));
        copyText(source, "date_created", order, "created_at");
        copyText(source, "date_updated", order, "updated_at");

        ArrayNode lineItems = order.putArray("line_items");
        for (JsonNode item : source.path("items")) {
            if (item.isObject()) {
                lineItems.add(lineItem(item));
            }
        }

        order.put("financial_status", SourceOrderStatus.fromValue(source.path("status").asText(null))
                .toFinancialStatus().getValue());
        SourceFulfillmentStatus.fromValue(source.path("fulfillment_status").asText(null))
                .toFulfillmentStatus()
                .ifPresentOrElse(status -> order.put("fulfillment_status", status.getValue()),
                        () -> order.putNull("fulfillment_status"));

        boolean subscriptionOrder = source.hasNonNull("subscription_id");
        order.put("tags", subscriptionOrder ? importTag + "," + importTag + "-subscription" : importTag);
        order.put("note", "Imported from source store");
        order.put("currency", currency);
        order.put("total_price", source.path("total").asText("0.00"));
        order.put("subtotal_price", source.path("subtotal").asText("0.00"));
        order.put("total_tax", source.path("tax").asText("0.00"));
        ObjectNode shopMoney = order.putObject("total_shipping_price_set").putObject("shop_money");
        shopMoney.put("amount", source.path("shipping").asText("0.00"));
        shopMoney.put("currency_code", currency);

        ObjectNode originalId = order.putArray("metafields").addObject();
        originalId.put("namespace", metafieldNamespace);
        originalId.put("key", "order_id");
        originalId.put("value", source.path("id").asText());
        originalId.put("type", "single_line_text_field");

        if (targetCustomerId != null) {
            order.putObject("customer").put("id", targetCustomerId);
        }
        address(source, "shipping_address").ifPresent(address -> order.set("shipping_address", address));
        address(source, "billing_address").ifPresent(address -> order.set("billing_address", address));

        if (source.hasNonNull("discount_amount") && source.path("discount_amount").asDouble() != 0) {
            ObjectNode discount = order.putArray("discount_applications").addObject();
            discount.put("type", "discount_code");
            discount.put("code", source.path("discount_code").asText("SOURCE_DISCOUNT"));
            discount.put("value", source.path("discount_amount").asText());
            discount.put("value_type", "fixed_amount");
            discount.put("allocation_method", "across");
        }
        return order;
    }

    @Override
    public Optional<ObjectNode> mapSubscriptionSummary(ObjectNode source) {
        String status = source.path("subscription_status").asText(null);
        if (status == null || status.isBlank() || "none".equals(status.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        ObjectNode metafield = objectMapper.createObjectNode();
        metafield.put("namespace", metafieldNamespace);
        metafield.put("key", "subscription_summary");
        metafield.put("type", "json");

        ObjectNode value = objectMapper.createObjectNode();
        value.put("migration_date", LocalDateTime.now().format(MIGRATION_DATE));
        value.put("source", "source_customer_record");
        ObjectNode data = value.putObject("subscription_data");
        data.put("source_customer_id", source.path("id").asText());
        data.put("subscription_status", status);
        data.put("total_revenue", source.path("total_revenue").asText("0"));
        data.put("currency", "USD");
        copyText(source, "date_created", data, "customer_since");
        copyText(source, "date_updated", data, "last_updated");
        // json metafields carry their value as a string
        metafield.put("value", value.toString());
        return Optional.of(metafield);
    }

    private ObjectNode lineItem(JsonNode item) {
        String sku = item.path("sku").asText("").trim();
        ObjectNode lineItem = objectMapper.createObjectNode();
        lineItem.put("title", item.path("product_name").asText("Unknown Product"));
        lineItem.put("quantity", item.path("quantity").asInt(1));
        lineItem.put("price", item.path("price").asText("0.00"));
        lineItem.put("sku", sku);
        lineItem.put("vendor", item.path("vendor").asText(""));
        lineItem.put("requires_shipping", true);
        lineItem.put("taxable", true);
        ArrayNode properties = lineItem.putArray("properties");
        ObjectNode productId = properties.addObject();
        productId.put("name", "Source Product ID");
        productId.put("value", item.path("product_id").asText(""));

        Optional<ProductVariantRef> variant = productCatalog.findBySku(sku);
        if (variant.isPresent()) {
            if (variant.get().getProductId() != null) {
                lineItem.put("product_id", variant.get().getProductId());
            }
            if (variant.get().getVariantId() != null) {
                lineItem.put("variant_id", variant.get().getVariantId());
            }
        } else if (!sku.isEmpty()) {
            log.debug("No target product found for SKU {}", sku);
            ObjectNode note = properties.addObject();
            note.put("name", "Migration Note");
            note.put("value", "Original SKU " + sku + " - no matching target product found");
        }
        return lineItem;
    }

    private Optional<ObjectNode> address(JsonNode source, String field) {
        JsonNode data = source.get(field);
        if (data == null || !data.isObject()) {
            data = source.get("address");
        }
        if (data == null || !data.isObject()) {
            return Optional.empty();
        }
        String line1 = data.path("line1").asText("");
        String city = data.path("city").asText("");
        if (line1.isBlank() || city.isBlank()) {
            return Optional.empty();
        }
        ObjectNode address = objectMapper.createObjectNode();
        address.put("first_name", data.path("first_name").asText(""));
        address.put("last_name", data.path("last_name").asText(""));
        address.put("company", data.path("company").asText(""));
        address.put("address1", line1);
        address.put("address2", data.path("line2").asText(""));
        address.put("city", city);
        address.put("province", data.path("state").asText(""));
        address.put("country", data.path("country").asText(""));
        address.put("zip", data.path("postal_code").asText(""));
        copyText(data, "phone", address, "phone");
        return Optional.of(address);
    }

    private static void copyText(JsonNode source, String sourceField, ObjectNode target, String targetField) {
        JsonNode value = source.get(sourceField);
        if (value != null && !value.isNull()) {
            target.put(targetField, value.asText());
        }
    }
}
