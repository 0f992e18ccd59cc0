package com.infomedia.abacox.storemigration.component.mapping;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatusMappingTest {

    @Test
    void orderStatusesMapToFinancialStatuses() {
        assertThat(SourceOrderStatus.fromValue("paid").toFinancialStatus()).isEqualTo(TargetFinancialStatus.PAID);
        assertThat(SourceOrderStatus.fromValue("completed").toFinancialStatus()).isEqualTo(TargetFinancialStatus.PAID);
        assertThat(SourceOrderStatus.fromValue("cancelled").toFinancialStatus()).isEqualTo(TargetFinancialStatus.VOIDED);
        assertThat(SourceOrderStatus.fromValue("refunded").toFinancialStatus()).isEqualTo(TargetFinancialStatus.REFUNDED);
        assertThat(SourceOrderStatus.fromValue("partially_refunded").toFinancialStatus())
                .isEqualTo(TargetFinancialStatus.PARTIALLY_REFUNDED);
        assertThat(SourceOrderStatus.fromValue("failed").toFinancialStatus()).isEqualTo(TargetFinancialStatus.PENDING);
    }

    @Test
    void unknownOrderStatusesDefaultToPending() {
        assertThat(SourceOrderStatus.fromValue("on_hold")).isEqualTo(SourceOrderStatus.UNKNOWN);
        assertThat(SourceOrderStatus.fromValue(null).toFinancialStatus()).isEqualTo(TargetFinancialStatus.PENDING);
        assertThat(SourceOrderStatus.fromValue("").toFinancialStatus()).isEqualTo(TargetFinancialStatus.PENDING);
    }

    @Test
    void fulfillmentStatusesWithoutCounterpartStayUnset() {
        assertThat(SourceFulfillmentStatus.fromValue("SHIPPED").toFulfillmentStatus())
                .contains(TargetFulfillmentStatus.SHIPPED);
        assertThat(SourceFulfillmentStatus.fromValue("delivered").toFulfillmentStatus())
                .contains(TargetFulfillmentStatus.DELIVERED);
        assertThat(SourceFulfillmentStatus.fromValue("processing").toFulfillmentStatus()).isEmpty();
        assertThat(SourceFulfillmentStatus.fromValue("lost").toFulfillmentStatus()).isEmpty();
    }

    @Test
    void targetValuesAreLowercaseWireValues() {
        assertThat(TargetFinancialStatus.PARTIALLY_REFUNDED.getValue()).isEqualTo("partially_refunded");
        assertThat(TargetFulfillmentStatus.FULFILLED.getValue()).isEqualTo("fulfilled");
    }
}
