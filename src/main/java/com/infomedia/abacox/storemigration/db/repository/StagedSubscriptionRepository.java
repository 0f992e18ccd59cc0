package com.infomedia.abacox.storemigration.db.repository;

import com.infomedia.abacox.storemigration.db.entity.StagedSubscription;

public interface StagedSubscriptionRepository extends OwnedStagedEntityRepository<StagedSubscription> {
}
