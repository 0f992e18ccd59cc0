package com.infomedia.abacox.storemigration.component.staging;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable keyed storage of raw source payloads, one table per {@link EntityKind}.
 */
public interface StagingStore {

    /**
     * Inserts or replaces every record by natural id inside one transaction. A record repeated in
     * the batch is written once, with its last occurrence.
     *
     * @throws com.infomedia.abacox.storemigration.exception.StagingWriteException when the batch
     *         cannot be committed; nothing from the batch is kept
     */
    void upsertBatch(EntityKind kind, List<StagingRecord> records);

    /**
     * All records owned by the given customer, in natural id order.
     *
     * @throws IllegalArgumentException for kinds without an owner
     * @throws CorruptPayloadException when a stored payload no longer decodes
     */
    List<StagingRecord> getByOwner(EntityKind kind, long ownerId);

    Optional<StagingRecord> findRecord(EntityKind kind, long naturalId);

    /**
     * Raw stored JSON for those of the given ids that exist. Undecoded so that audits can report
     * corrupt rows instead of failing on them.
     */
    Map<Long, String> findRawPayloads(EntityKind kind, Collection<Long> naturalIds);

    /**
     * The subset of {@code naturalIds} present in storage. Input of any size is accepted.
     */
    Set<Long> containsAny(EntityKind kind, Collection<Long> naturalIds);

    long count(EntityKind kind);

    /**
     * Number of distinct owners among the records of a kind with an owner; 0 for customers.
     */
    long countDistinctOwners(EntityKind kind);

    List<Long> findAllNaturalIds(EntityKind kind);

    List<Long> findNaturalIdsBetween(EntityKind kind, long fromId, long toId);

    /**
     * Customer ids that satisfy the migration eligibility predicate, ascending.
     *
     * @param limit maximum number of ids, or null for all
     */
    List<Long> findEligibleCustomerIds(Integer limit);

    /**
     * Irreversibly removes every staged record of a kind.
     *
     * @return number of rows before the wipe
     */
    long deleteAll(EntityKind kind);
}
