package com.infomedia.abacox.storemigration.component.mapping;

import java.util.Locale;

/**
 * Order status values of the source platform. Anything unrecognized is {@link #UNKNOWN} and
 * maps to {@link TargetFinancialStatus#PENDING}.
 */
public enum SourceOrderStatus {
    PAID(TargetFinancialStatus.PAID),
    COMPLETED(TargetFinancialStatus.PAID),
    PENDING(TargetFinancialStatus.PENDING),
    CANCELLED(TargetFinancialStatus.VOIDED),
    REFUNDED(TargetFinancialStatus.REFUNDED),
    PARTIALLY_REFUNDED(TargetFinancialStatus.PARTIALLY_REFUNDED),
    FAILED(TargetFinancialStatus.PENDING),
    UNKNOWN(TargetFinancialStatus.PENDING);

    private final TargetFinancialStatus financialStatus;

    SourceOrderStatus(TargetFinancialStatus financialStatus) {
        this.financialStatus = financialStatus;
    }

    public TargetFinancialStatus toFinancialStatus() {
        return financialStatus;
    }

    public static SourceOrderStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
