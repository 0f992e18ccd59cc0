package com.infomedia.abacox.storemigration.component.mapping;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TargetFulfillmentStatus {
    SHIPPED,
    DELIVERED,
    FULFILLED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
