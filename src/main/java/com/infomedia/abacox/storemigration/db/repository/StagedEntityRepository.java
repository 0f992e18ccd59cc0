package com.infomedia.abacox.storemigration.db.repository;

import com.infomedia.abacox.storemigration.db.entity.superclass.StagedEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

@NoRepositoryBean
public interface StagedEntityRepository<T extends StagedEntity> extends JpaRepository<T, Long> {

    @Query("SELECT e.naturalId FROM #{#entityName} e WHERE e.naturalId IN :ids")
    List<Long> findExistingNaturalIds(@Param("ids") Collection<Long> ids);

    @Query("SELECT e.naturalId FROM #{#entityName} e ORDER BY e.naturalId")
    List<Long> findAllNaturalIds();

    @Query("SELECT e.naturalId FROM #{#entityName} e WHERE e.naturalId BETWEEN :fromId AND :toId ORDER BY e.naturalId")
    List<Long> findNaturalIdsBetween(@Param("fromId") long fromId, @Param("toId") long toId);

    List<T> findByNaturalIdIn(Collection<Long> naturalIds);
}
