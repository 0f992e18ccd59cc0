package com.infomedia.abacox.storemigration.db.repository;

import com.infomedia.abacox.storemigration.db.entity.StagedCustomer;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface StagedCustomerRepository extends StagedEntityRepository<StagedCustomer> {

    /**
     * Customers worth migrating: at least one staged order, a subscription indicator other than
     * "none", or non-zero historical revenue.
     */
    @Query("""
            SELECT c.naturalId FROM StagedCustomer c
            WHERE EXISTS (SELECT 1 FROM StagedOrder o WHERE o.ownerId = c.naturalId)
               OR (c.subscriptionStatus IS NOT NULL AND LOWER(c.subscriptionStatus) <> 'none')
               OR c.totalRevenue > 0
            ORDER BY c.naturalId
            """)
    List<Long> findEligibleForMigration(Pageable pageable);
}
