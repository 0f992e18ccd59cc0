package com.infomedia.abacox.storemigration.component.staging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.db.entity.StagedCustomer;
import com.infomedia.abacox.storemigration.db.repository.StagedCustomerRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaStagingStore.class)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
class JpaStagingStoreTest {

    private static final LocalDateTime FETCHED_AT = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Autowired
    private JpaStagingStore store;

    @Autowired
    private StagedCustomerRepository customerRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void upsertingTheSameRecordTwiceKeepsOneRowWithTheLatestPayload() {
        store.upsertBatch(EntityKind.CUSTOMER, List.of(customer(1, "old@example.com")));
        store.upsertBatch(EntityKind.CUSTOMER, List.of(customer(1, "new@example.com")));

        assertThat(store.count(EntityKind.CUSTOMER)).isEqualTo(1);
        StagingRecord stored = store.findRecord(EntityKind.CUSTOMER, 1).orElseThrow();
        assertThat(stored.getPayload().get("email").asText()).isEqualTo("new@example.com");
        assertThat(customerRepository.findById(1L)).get()
                .extracting(StagedCustomer::getEmail).isEqualTo("new@example.com");
    }

    @Test
    void duplicateIdsInOneBatchKeepTheLastOccurrence() {
        store.upsertBatch(EntityKind.CUSTOMER, List.of(
                customer(5, "first@example.com"),
                customer(6, "other@example.com"),
                customer(5, "last@example.com")));

        assertThat(store.count(EntityKind.CUSTOMER)).isEqualTo(2);
        assertThat(store.findRecord(EntityKind.CUSTOMER, 5).orElseThrow().getPayload().get("email").asText())
                .isEqualTo("last@example.com");
    }

    @Test
    void lookupsSpanningManyInClauseChunksReturnTheFullSubset() {
        List<StagingRecord> records = new ArrayList<>();
        for (long id = 1; id <= 20; id++) {
            records.add(customer(id, "c" + id + "@example.com"));
        }
        store.upsertBatch(EntityKind.CUSTOMER, records);

        List<Long> probe = LongStream.rangeClosed(10, 30).boxed().collect(Collectors.toList());

        assertThat(store.containsAny(EntityKind.CUSTOMER, probe))
                .containsExactlyInAnyOrderElementsOf(LongStream.rangeClosed(10, 20).boxed().collect(Collectors.toList()));
        Map<Long, String> raw = store.findRawPayloads(EntityKind.CUSTOMER, probe);
        assertThat(raw).hasSize(11);
        assertThat(raw.get(12L)).contains("c12@example.com");
    }

    @Test
    void ordersAreGroupedByOwnerInIdOrder() {
        store.upsertBatch(EntityKind.ORDER, List.of(order(30, 7), order(10, 7), order(20, 8)));

        List<StagingRecord> owned = store.getByOwner(EntityKind.ORDER, 7);

        assertThat(owned).extracting(StagingRecord::getNaturalId).containsExactly(10L, 30L);
        assertThat(owned).extracting(StagingRecord::getOwnerId).containsOnly(7L);
        assertThat(store.countDistinctOwners(EntityKind.ORDER)).isEqualTo(2);
        assertThat(store.countDistinctOwners(EntityKind.CUSTOMER)).isZero();
    }

    @Test
    void customersHaveNoOwnerLookup() {
        assertThatThrownBy(() -> store.getByOwner(EntityKind.CUSTOMER, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void eligibleCustomersHaveOrdersSubscriptionsOrRevenue() {
        ObjectNode withRevenue = payload(2, "rev@example.com").put("total_revenue", "19.99");
        ObjectNode subscribed = payload(3, "sub@example.com").put("subscription_status", "active");
        ObjectNode unsubscribed = payload(4, "none@example.com").put("subscription_status", "none");
        store.upsertBatch(EntityKind.CUSTOMER, List.of(
                customer(1, "orders@example.com"),
                record(EntityKind.CUSTOMER, withRevenue),
                record(EntityKind.CUSTOMER, subscribed),
                record(EntityKind.CUSTOMER, unsubscribed),
                customer(5, "idle@example.com")));
        store.upsertBatch(EntityKind.ORDER, List.of(order(100, 1)));

        assertThat(store.findEligibleCustomerIds(null)).containsExactly(1L, 2L, 3L);
        assertThat(store.findEligibleCustomerIds(2)).containsExactly(1L, 2L);
    }

    @Test
    void idRangeQueriesAreInclusiveAndOrdered() {
        store.upsertBatch(EntityKind.CUSTOMER, List.of(
                customer(9, "a@example.com"), customer(3, "b@example.com"), customer(5, "c@example.com")));

        assertThat(store.findAllNaturalIds(EntityKind.CUSTOMER)).containsExactly(3L, 5L, 9L);
        assertThat(store.findNaturalIdsBetween(EntityKind.CUSTOMER, 3, 5)).containsExactly(3L, 5L);
        assertThat(store.findNaturalIdsBetween(EntityKind.CUSTOMER, 6, 4)).isEmpty();
    }

    @Test
    void deleteAllReportsTheRemovedRowCount() {
        store.upsertBatch(EntityKind.SUBSCRIPTION, List.of(
                record(EntityKind.SUBSCRIPTION, payload(1, null).put("customer_id", 4)),
                record(EntityKind.SUBSCRIPTION, payload(2, null).put("customer_id", 4))));

        assertThat(store.deleteAll(EntityKind.SUBSCRIPTION)).isEqualTo(2);
        assertThat(store.count(EntityKind.SUBSCRIPTION)).isZero();
    }

    private StagingRecord customer(long id, String email) {
        return record(EntityKind.CUSTOMER, payload(id, email));
    }

    private StagingRecord order(long id, long customerId) {
        return record(EntityKind.ORDER, payload(id, null).put("customer_id", customerId).put("status", "paid"));
    }

    private ObjectNode payload(long id, String email) {
        ObjectNode node = objectMapper.createObjectNode().put("id", id);
        if (email != null) {
            node.put("email", email);
        }
        return node;
    }

    private static StagingRecord record(EntityKind kind, ObjectNode payload) {
        return StagingRecord.fromSource(kind, payload, FETCHED_AT);
    }
}
