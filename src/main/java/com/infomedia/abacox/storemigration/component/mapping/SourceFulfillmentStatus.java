package com.infomedia.abacox.storemigration.component.mapping;

import java.util.Locale;
import java.util.Optional;

/**
 * Fulfillment status values of the source platform. Statuses without a target counterpart
 * (pending, processing, cancelled, unknown) leave the target fulfillment status unset.
 */
public enum SourceFulfillmentStatus {
    SHIPPED(TargetFulfillmentStatus.SHIPPED),
    DELIVERED(TargetFulfillmentStatus.DELIVERED),
    FULFILLED(TargetFulfillmentStatus.FULFILLED),
    PENDING(null),
    PROCESSING(null),
    CANCELLED(null),
    UNKNOWN(null);

    private final TargetFulfillmentStatus fulfillmentStatus;

    SourceFulfillmentStatus(TargetFulfillmentStatus fulfillmentStatus) {
        this.fulfillmentStatus = fulfillmentStatus;
    }

    public Optional<TargetFulfillmentStatus> toFulfillmentStatus() {
        return Optional.ofNullable(fulfillmentStatus);
    }

    public static SourceFulfillmentStatus fromValue(String value) {
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
