package com.infomedia.abacox.storemigration.component.collection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.component.staging.StagingStore;
import com.infomedia.abacox.storemigration.exception.StagingWriteException;
import com.infomedia.abacox.storemigration.support.InMemoryStagingStore;
import com.infomedia.abacox.storemigration.support.ManualTimeSource;
import com.infomedia.abacox.storemigration.support.StubSourceApi;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class PaginatedCollectorTest {

    private final StubSourceApi sourceApi = new StubSourceApi();
    private final InMemoryStagingStore stagingStore = new InMemoryStagingStore();
    private final ManualTimeSource time = new ManualTimeSource();
    private final PaginatedCollector collector = new PaginatedCollector(sourceApi, stagingStore, time);

    private static CollectionParams.CollectionParamsBuilder customers() {
        return CollectionParams.builder().kind(EntityKind.CUSTOMER);
    }

    @Test
    void collectsEveryPageUntilTheSourceRunsDry() {
        sourceApi.customerPage(0, 1, 1000)
                .customerPage(1, 1001, 1000)
                .customerPage(2, 2001, 1000);

        CollectionResult result = collector.collect(customers().build(), CancellationToken.none(), null);

        assertThat(result.getCollected()).isEqualTo(3000);
        assertThat(result.getFailed()).isZero();
        assertThat(result.getFinalPage()).isEqualTo(3);
        assertThat(result.getState()).isEqualTo(CollectionState.DONE);
        assertThat(stagingStore.count(EntityKind.CUSTOMER)).isEqualTo(3000);
        assertThat(sourceApi.getRequestedPages()).containsExactly(0, 1, 2, 3);
        assertThat(time.getSleeps()).containsOnly(Duration.ofMillis(200)).hasSize(3);
    }

    @Test
    void pageWithoutNextLinkEndsTheRun() {
        sourceApi.page(0, List.of(StubSourceApi.customer(1), StubSourceApi.customer(2)), null);

        CollectionResult result = collector.collect(customers().build(), CancellationToken.none(), null);

        assertThat(result.getState()).isEqualTo(CollectionState.DONE);
        assertThat(result.getFinalPage()).isZero();
        assertThat(result.getCollected()).isEqualTo(2);
        assertThat(sourceApi.getRequestedPages()).containsExactly(0);
    }

    @Test
    void unparsableNextLinkFallsBackToTheFollowingPage() {
        sourceApi.page(0, List.of(StubSourceApi.customer(1)), "https://source.example.com/v1/customers/?cursor=xyz")
                .page(1, List.of(StubSourceApi.customer(2)), null);

        CollectionResult result = collector.collect(customers().build(), CancellationToken.none(), null);

        assertThat(sourceApi.getRequestedPages()).containsExactly(0, 1);
        assertThat(result.getFinalPage()).isEqualTo(1);
        assertThat(result.getCollected()).isEqualTo(2);
    }

    @Test
    void nextLinkThatDoesNotMoveForwardFallsBackToTheFollowingPage() {
        sourceApi.page(0, List.of(StubSourceApi.customer(1)), "https://source.example.com/v1/customers/?page=0&limit=1")
                .page(1, List.of(StubSourceApi.customer(2)), "https://source.example.com/v1/customers/?page=0&limit=1")
                .page(2, List.of(StubSourceApi.customer(3)), null);

        CollectionResult result = assertTimeoutPreemptively(Duration.ofSeconds(3),
                () -> collector.collect(customers().build(), CancellationToken.none(), null));

        assertThat(sourceApi.getRequestedPages()).containsExactly(0, 1, 2);
        assertThat(result.getState()).isEqualTo(CollectionState.DONE);
        assertThat(result.getFinalPage()).isEqualTo(2);
        assertThat(result.getCollected()).isEqualTo(3);
    }

    @Test
    void resumesFromTheRequestedStartPage() {
        sourceApi.customerPage(5, 501, 10);

        CollectionResult result = collector.collect(customers().startPage(5).pageSize(10).build(),
                CancellationToken.none(), null);

        assertThat(sourceApi.getRequestedPages()).containsExactly(5, 6);
        assertThat(result.getCollected()).isEqualTo(10);
        assertThat(result.getFinalPage()).isEqualTo(6);
    }

    @Test
    void failedPageIsCountedAndSkipped() {
        sourceApi.customerPage(0, 1, 5)
                .failPage(1)
                .customerPage(2, 11, 5);

        CollectionResult result = collector.collect(customers().pageSize(5).build(), CancellationToken.none(), null);

        assertThat(sourceApi.getRequestedPages()).containsExactly(0, 1, 2, 3);
        assertThat(result.getCollected()).isEqualTo(10);
        assertThat(result.getFailed()).isEqualTo(5);
        assertThat(result.getState()).isEqualTo(CollectionState.DONE);
    }

    @Test
    void tooManyConsecutiveFailuresAbortTheRun() {
        sourceApi.failEverything();

        assertThatThrownBy(() -> collector.collect(customers().pageSize(10).maxConsecutiveFailures(2).build(),
                CancellationToken.none(), null))
                .isInstanceOfSatisfying(CollectionAbortedException.class, e -> {
                    assertThat(e.getPartialResult().getFailed()).isEqualTo(30);
                    assertThat(e.getPartialResult().getCollected()).isZero();
                    assertThat(e.getPartialResult().getState()).isEqualTo(CollectionState.ABORTED);
                });

        assertThat(sourceApi.getRequestedPages()).containsExactly(0, 1, 2);
    }

    @Test
    void stagingCommitFailureAbortsWithThePageCountedAsFailed() {
        StagingStore failingStore = mock(StagingStore.class);
        doThrow(new StagingWriteException("disk full", 5, null)).when(failingStore).upsertBatch(any(), anyList());
        PaginatedCollector failingCollector = new PaginatedCollector(sourceApi, failingStore, time);
        sourceApi.customerPage(0, 1, 5);

        assertThatThrownBy(() -> failingCollector.collect(customers().pageSize(5).build(),
                CancellationToken.none(), null))
                .isInstanceOfSatisfying(StagingBatchCommitException.class, e -> {
                    assertThat(e.getPartialResult().getFailed()).isEqualTo(5);
                    assertThat(e.getPartialResult().getCollected()).isZero();
                    assertThat(e.getPartialResult().getState()).isEqualTo(CollectionState.ABORTED);
                    assertThat(e.getCause()).isInstanceOf(StagingWriteException.class);
                });
    }

    @Test
    void cancellationIsHonouredAtThePageBoundary() {
        sourceApi.customerPage(0, 1, 5)
                .customerPage(1, 6, 5);
        CancellationToken token = new CancellationToken();

        CollectionResult result = collector.collect(customers().pageSize(5).build(), token, status -> {
            if (((Number) status.get("collected")).longValue() >= 5) {
                token.cancel();
            }
        });

        assertThat(result.getState()).isEqualTo(CollectionState.STOPPED);
        assertThat(result.getCollected()).isEqualTo(5);
        assertThat(result.getFinalPage()).isEqualTo(1);
        assertThat(sourceApi.getRequestedPages()).containsExactly(0);
    }

    @Test
    void cancelledBeforeStartFetchesNothing() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        CollectionResult result = collector.collect(customers().build(), token, null);

        assertThat(result.getState()).isEqualTo(CollectionState.STOPPED);
        assertThat(result.getPagesFetched()).isZero();
        assertThat(sourceApi.getRequestedPages()).isEmpty();
    }

    @Test
    void unusableElementsAreCountedAsFailedWithoutStoppingThePage() {
        List<JsonNode> results = List.of(
                StubSourceApi.customer(1),
                TextNode.valueOf("not a record"),
                StubSourceApi.MAPPER.createObjectNode().put("email", "no-id@example.com"),
                StubSourceApi.customer(2));
        sourceApi.page(0, results, null);

        CollectionResult result = collector.collect(customers().build(), CancellationToken.none(), null);

        assertThat(result.getCollected()).isEqualTo(2);
        assertThat(result.getFailed()).isEqualTo(2);
        assertThat(stagingStore.findAllNaturalIds(EntityKind.CUSTOMER)).containsExactly(1L, 2L);
    }

    @Test
    void progressIsReportedWithinAPageAndAfterIt() {
        sourceApi.page(0, List.of(StubSourceApi.customer(1), StubSourceApi.customer(2), StubSourceApi.customer(3),
                StubSourceApi.customer(4), StubSourceApi.customer(5)), null);
        List<Map<String, Object>> reports = new ArrayList<>();

        collector.collect(customers().progressEvery(2).build(), CancellationToken.none(), reports::add);

        assertThat(reports).filteredOn(r -> r.containsKey("pageProcessed"))
                .extracting(r -> r.get("pageProcessed"))
                .containsExactly(2, 4);
        assertThat(reports.get(reports.size() - 1))
                .containsEntry("state", "DONE")
                .containsEntry("collected", 5L);
    }

    @Test
    void failingListenerDoesNotBreakTheRun() {
        sourceApi.customerPage(0, 1, 3);

        CollectionResult result = collector.collect(customers().build(), CancellationToken.none(), status -> {
            throw new IllegalStateException("listener failure");
        });

        assertThat(result.getCollected()).isEqualTo(3);
        assertThat(result.getState()).isEqualTo(CollectionState.DONE);
    }
}
