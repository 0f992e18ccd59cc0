package com.infomedia.abacox.storemigration.db.repository;

import com.infomedia.abacox.storemigration.db.entity.MigrationStatus;
import com.infomedia.abacox.storemigration.db.entity.OrderMigration;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OrderMigrationRepository extends JpaRepository<OrderMigration, Long> {

    long countByStatus(MigrationStatus status);

    List<OrderMigration> findByCustomerNaturalId(Long customerNaturalId);
}
