package com.infomedia.abacox.storemigration.component.staging;

import com.fasterxml.jackson.databind.JsonNode;
import com.infomedia.abacox.storemigration.exception.UnknownEntityKindException;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

/**
 * The kinds of source records that are collected, each with its own staging table.
 * Declares the only payload fields the core reads by name: the natural id, the owner reference
 * and a human-readable label used in audit reports.
 */
@Getter
public enum EntityKind {

    CUSTOMER("customers/", List.of(), "email"),
    ORDER("orders/", List.of("customer_id", "customer.id"), "customer_email"),
    SUBSCRIPTION("subscriptions/", List.of("customer_id", "customer.id"), "status");

    public static final String ID_FIELD = "id";

    private final String endpoint;
    private final List<String> ownerFieldPaths;
    private final String labelField;

    EntityKind(String endpoint, List<String> ownerFieldPaths, String labelField) {
        this.endpoint = endpoint;
        this.ownerFieldPaths = ownerFieldPaths;
        this.labelField = labelField;
    }

    public boolean hasOwner() {
        return !ownerFieldPaths.isEmpty();
    }

    /**
     * Reads the natural id. Accepts integral numbers and numeric strings; anything else is absent.
     */
    public OptionalLong naturalId(JsonNode payload) {
        return asLong(payload == null ? null : payload.get(ID_FIELD));
    }

    /**
     * Reads the owning customer's id from the first owner field path that holds a usable value.
     */
    public OptionalLong ownerId(JsonNode payload) {
        if (payload == null) {
            return OptionalLong.empty();
        }
        for (String path : ownerFieldPaths) {
            JsonNode node = payload;
            for (String part : path.split("\\.")) {
                node = node == null ? null : node.get(part);
            }
            OptionalLong value = asLong(node);
            if (value.isPresent()) {
                return value;
            }
        }
        return OptionalLong.empty();
    }

    public String label(JsonNode payload) {
        if (payload == null) {
            return "N/A";
        }
        JsonNode node = payload.get(labelField);
        return node == null || node.isNull() ? "N/A" : node.asText();
    }

    public static EntityKind fromPathValue(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            if (normalized.endsWith("S")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            for (EntityKind kind : values()) {
                if (kind.name().equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new UnknownEntityKindException(value);
    }

    private static OptionalLong asLong(JsonNode node) {
        if (node == null || node.isNull()) {
            return OptionalLong.empty();
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            long value = node.asLong();
            return value != 0 ? OptionalLong.of(value) : OptionalLong.empty();
        }
        if (node.isTextual()) {
            try {
                long value = Long.parseLong(node.asText().trim());
                return value != 0 ? OptionalLong.of(value) : OptionalLong.empty();
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }
}
