package com.infomedia.abacox.storemigration.db.entity;

import com.infomedia.abacox.storemigration.db.entity.superclass.StagedEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

@Entity
@Table(
    name = "staged_customer",
    indexes = {
        @Index(name = "idx_staged_customer_email", columnList = "email")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class StagedCustomer extends StagedEntity {

    @Column(name = "email", length = 320)
    private String email;

    /**
     * Subscription indicator embedded in the customer record, e.g. "active", "cancelled" or "none".
     */
    @Column(name = "subscription_status", length = 50)
    private String subscriptionStatus;

    @Column(name = "total_revenue", precision = 19, scale = 4)
    private BigDecimal totalRevenue;
}
