package com.infomedia.abacox.storemigration.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;

/**
 * Outcome of migrating one customer unit to the target platform.
 */
@Entity
@Table(
    name = "customer_migration",
    indexes = {
        @Index(name = "idx_customer_migration_status", columnList = "status")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class CustomerMigration {

    /**
     * Natural id of the staged source customer.
     */
    @Id
    @Column(name = "natural_id", nullable = false)
    private Long naturalId;

    /**
     * Id assigned by the target platform; null until the customer was created.
     */
    @Column(name = "target_id")
    private Long targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MigrationStatus status;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @Column(name = "orders_migrated", nullable = false)
    private int ordersMigrated;

    @Column(name = "orders_failed", nullable = false)
    private int ordersFailed;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
