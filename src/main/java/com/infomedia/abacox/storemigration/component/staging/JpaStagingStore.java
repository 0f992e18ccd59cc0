package com.infomedia.abacox.storemigration.component.staging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.db.entity.StagedCustomer;
import com.infomedia.abacox.storemigration.db.entity.StagedOrder;
import com.infomedia.abacox.storemigration.db.entity.StagedSubscription;
import com.infomedia.abacox.storemigration.db.entity.superclass.OwnedStagedEntity;
import com.infomedia.abacox.storemigration.db.entity.superclass.StagedEntity;
import com.infomedia.abacox.storemigration.db.repository.OwnedStagedEntityRepository;
import com.infomedia.abacox.storemigration.db.repository.StagedCustomerRepository;
import com.infomedia.abacox.storemigration.db.repository.StagedEntityRepository;
import com.infomedia.abacox.storemigration.db.repository.StagedOrderRepository;
import com.infomedia.abacox.storemigration.db.repository.StagedSubscriptionRepository;
import com.infomedia.abacox.storemigration.db.util.InClauseChunker;
import com.infomedia.abacox.storemigration.exception.StagingWriteException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@Log4j2
public class JpaStagingStore implements StagingStore {

    private final StagedCustomerRepository customerRepository;
    private final StagedOrderRepository orderRepository;
    private final StagedSubscriptionRepository subscriptionRepository;
    private final ObjectMapper objectMapper;

    @PersistenceContext
    private EntityManager entityManager;

    @Value("${store-migration.staging.in-clause-chunk-size:999}")
    private int inClauseChunkSize = InClauseChunker.DEFAULT_CHUNK_SIZE;

    public JpaStagingStore(StagedCustomerRepository customerRepository,
                           StagedOrderRepository orderRepository,
                           StagedSubscriptionRepository subscriptionRepository,
                           ObjectMapper objectMapper) {
        this.customerRepository = customerRepository;
        this.orderRepository = orderRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void upsertBatch(EntityKind kind, List<StagingRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }

        // Last occurrence of an id wins
        Map<Long, StagingRecord> byId = new LinkedHashMap<>();
        for (StagingRecord record : records) {
            byId.remove(record.getNaturalId());
            byId.put(record.getNaturalId(), record);
        }

        try {
            StagedEntityRepository<? extends StagedEntity> repository = repository(kind);
            Map<Long, StagedEntity> existing = InClauseChunker
                    .<StagedEntity>queryInChunks(byId.keySet(), inClauseChunkSize, repository::findByNaturalIdIn)
                    .stream()
                    .collect(Collectors.toMap(StagedEntity::getNaturalId, Function.identity()));

            int inserted = 0;
            for (StagingRecord record : byId.values()) {
                StagedEntity entity = existing.get(record.getNaturalId());
                boolean isNew = entity == null;
                if (isNew) {
                    entity = newEntity(kind);
                    entity.setNaturalId(record.getNaturalId());
                }
                apply(kind, entity, record);
                if (isNew) {
                    entityManager.persist(entity);
                    inserted++;
                }
            }
            entityManager.flush();
            log.debug("Staged {} {} records ({} new, {} replaced)",
                    byId.size(), kind, inserted, byId.size() - inserted);
        } catch (RuntimeException e) {
            throw new StagingWriteException("Failed to stage batch of " + byId.size() + " " + kind + " records: "
                    + e.getMessage(), byId.size(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<StagingRecord> getByOwner(EntityKind kind, long ownerId) {
        return ownedRepository(kind).findByOwnerIdOrderByNaturalId(ownerId).stream()
                .map(entity -> toRecord(kind, entity))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StagingRecord> findRecord(EntityKind kind, long naturalId) {
        return repository(kind).findById(naturalId).map(entity -> toRecord(kind, entity));
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, String> findRawPayloads(EntityKind kind, Collection<Long> naturalIds) {
        StagedEntityRepository<? extends StagedEntity> repository = repository(kind);
        return InClauseChunker.<StagedEntity>queryInChunks(naturalIds, inClauseChunkSize, repository::findByNaturalIdIn)
                .stream()
                .collect(Collectors.toMap(StagedEntity::getNaturalId, StagedEntity::getPayload));
    }

    @Override
    @Transactional(readOnly = true)
    public Set<Long> containsAny(EntityKind kind, Collection<Long> naturalIds) {
        StagedEntityRepository<? extends StagedEntity> repository = repository(kind);
        return new HashSet<>(InClauseChunker.<Long>queryInChunks(
                naturalIds, inClauseChunkSize, repository::findExistingNaturalIds));
    }

    @Override
    @Transactional(readOnly = true)
    public long count(EntityKind kind) {
        return repository(kind).count();
    }

    @Override
    @Transactional(readOnly = true)
    public long countDistinctOwners(EntityKind kind) {
        return kind.hasOwner() ? ownedRepository(kind).countDistinctOwners() : 0L;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findAllNaturalIds(EntityKind kind) {
        return repository(kind).findAllNaturalIds();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findNaturalIdsBetween(EntityKind kind, long fromId, long toId) {
        if (fromId > toId) {
            return List.of();
        }
        return repository(kind).findNaturalIdsBetween(fromId, toId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Long> findEligibleCustomerIds(Integer limit) {
        Pageable pageable = limit == null ? Pageable.unpaged() : PageRequest.of(0, Math.max(limit, 1));
        return customerRepository.findEligibleForMigration(pageable);
    }

    @Override
    @Transactional
    public long deleteAll(EntityKind kind) {
        StagedEntityRepository<? extends StagedEntity> repository = repository(kind);
        long before = repository.count();
        repository.deleteAllInBatch();
        log.warn("Deleted all {} staged {} records", before, kind);
        return before;
    }

    private StagedEntityRepository<? extends StagedEntity> repository(EntityKind kind) {
        return switch (kind) {
            case CUSTOMER -> customerRepository;
            case ORDER -> orderRepository;
            case SUBSCRIPTION -> subscriptionRepository;
        };
    }

    private OwnedStagedEntityRepository<? extends OwnedStagedEntity> ownedRepository(EntityKind kind) {
        return switch (kind) {
            case ORDER -> orderRepository;
            case SUBSCRIPTION -> subscriptionRepository;
            case CUSTOMER -> throw new IllegalArgumentException(kind + " records have no owner");
        };
    }

    private static StagedEntity newEntity(EntityKind kind) {
        return switch (kind) {
            case CUSTOMER -> new StagedCustomer();
            case ORDER -> new StagedOrder();
            case SUBSCRIPTION -> new StagedSubscription();
        };
    }

    private void apply(EntityKind kind, StagedEntity entity, StagingRecord record) {
        ObjectNode payload = record.getPayload();
        entity.setPayload(writePayload(payload));
        entity.setFetchedAt(record.getFetchedAt() != null ? record.getFetchedAt() : LocalDateTime.now());
        if (entity instanceof OwnedStagedEntity owned) {
            owned.setOwnerId(record.getOwnerId());
        }
        if (entity instanceof StagedCustomer customer) {
            customer.setEmail(truncate(text(payload, "email"), 320));
            customer.setSubscriptionStatus(truncate(text(payload, "subscription_status"), 50));
            customer.setTotalRevenue(decimal(payload, "total_revenue"));
        }
    }

    private String writePayload(ObjectNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload cannot be serialized", e);
        }
    }

    private StagingRecord toRecord(EntityKind kind, StagedEntity entity) {
        JsonNode node;
        try {
            node = objectMapper.readTree(entity.getPayload());
        } catch (JsonProcessingException e) {
            throw new CorruptPayloadException(kind, entity.getNaturalId(), e);
        }
        if (node == null || !node.isObject()) {
            throw new CorruptPayloadException(kind, entity.getNaturalId(), null);
        }
        return StagingRecord.builder()
                .naturalId(entity.getNaturalId())
                .ownerId(entity instanceof OwnedStagedEntity owned ? owned.getOwnerId() : null)
                .payload((ObjectNode) node)
                .fetchedAt(entity.getFetchedAt())
                .build();
    }

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static BigDecimal decimal(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
