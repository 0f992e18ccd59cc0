package com.infomedia.abacox.storemigration.db.entity;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;

@Entity
@Table(
    name = "order_migration",
    indexes = {
        @Index(name = "idx_order_migration_customer", columnList = "customer_natural_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class OrderMigration {

    @Id
    @Column(name = "natural_id", nullable = false)
    private Long naturalId;

    @Column(name = "customer_natural_id", nullable = false)
    private Long customerNaturalId;

    @Column(name = "target_id")
    private Long targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MigrationStatus status;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
