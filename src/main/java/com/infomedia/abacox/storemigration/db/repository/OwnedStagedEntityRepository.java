package com.infomedia.abacox.storemigration.db.repository;

import com.infomedia.abacox.storemigration.db.entity.superclass.OwnedStagedEntity;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.List;

@NoRepositoryBean
public interface OwnedStagedEntityRepository<T extends OwnedStagedEntity> extends StagedEntityRepository<T> {

    List<T> findByOwnerIdOrderByNaturalId(Long ownerId);

    @Query("SELECT COUNT(DISTINCT e.ownerId) FROM #{#entityName} e")
    long countDistinctOwners();
}
