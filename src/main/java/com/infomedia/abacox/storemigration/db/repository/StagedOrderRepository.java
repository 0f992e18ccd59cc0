package com.infomedia.abacox.storemigration.db.repository;

import com.infomedia.abacox.storemigration.db.entity.StagedOrder;

public interface StagedOrderRepository extends OwnedStagedEntityRepository<StagedOrder> {
}
