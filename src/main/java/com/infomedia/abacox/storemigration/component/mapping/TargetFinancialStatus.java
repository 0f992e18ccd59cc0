package com.infomedia.abacox.storemigration.component.mapping;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TargetFinancialStatus {
    PENDING,
    PAID,
    VOIDED,
    REFUNDED,
    PARTIALLY_REFUNDED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
