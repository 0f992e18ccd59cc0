package com.infomedia.abacox.storemigration.component.migration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.infomedia.abacox.storemigration.db.entity.MigrationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one migration unit. A unit succeeds once its target customer exists, whatever
 * happened to its orders, tags and metafields.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnitOutcome {
    private long customerId;
    private String email;
    private MigrationStatus status;
    private Long targetCustomerId;
    private String error;
    private boolean dryRun;
    private boolean tagged;
    private boolean subscriptionSummaryAttached;
    @Builder.Default
    private List<OrderOutcome> orders = new ArrayList<>();

    @JsonIgnore
    public boolean isSuccess() {
        return status == MigrationStatus.SUCCESS;
    }

    public int getOrdersMigrated() {
        return (int) orders.stream().filter(order -> order.getStatus() == MigrationStatus.SUCCESS).count();
    }

    public int getOrdersFailed() {
        return (int) orders.stream().filter(order -> order.getStatus() == MigrationStatus.FAILED).count();
    }

    public static UnitOutcome failed(long customerId, String email, String error, boolean dryRun) {
        return UnitOutcome.builder()
                .customerId(customerId)
                .email(email)
                .status(MigrationStatus.FAILED)
                .error(error)
                .dryRun(dryRun)
                .build();
    }
}
