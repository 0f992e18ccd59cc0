package com.infomedia.abacox.storemigration.db.repository;

import com.infomedia.abacox.storemigration.db.entity.CustomerMigration;
import com.infomedia.abacox.storemigration.db.entity.MigrationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface CustomerMigrationRepository extends JpaRepository<CustomerMigration, Long> {

    long countByStatus(MigrationStatus status);

    List<CustomerMigration> findByStatus(MigrationStatus status);

    @Query("SELECT m.naturalId FROM CustomerMigration m WHERE m.status = :status AND m.naturalId IN :ids")
    List<Long> findNaturalIdsByStatusIn(@Param("status") MigrationStatus status, @Param("ids") Collection<Long> ids);
}
