package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.component.staging.StagingRecord;
import com.infomedia.abacox.storemigration.support.InMemoryStagingStore;
import com.infomedia.abacox.storemigration.support.StubSourceApi;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class StagingAuditorTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final StubSourceApi sourceApi = new StubSourceApi();
    private final InMemoryStagingStore stagingStore = new InMemoryStagingStore();
    private final StagingAuditor auditor = new StagingAuditor(sourceApi, stagingStore, objectMapper);

    @Test
    void rangeAuditReportsExactlyTheUnstagedIds() {
        stage(LongStream.rangeClosed(1, 500));
        stage(LongStream.rangeClosed(600, 900));
        for (int page = 0; page < 10; page++) {
            sourceApi.customerPage(page, page * 100L + 1, 100);
        }

        RangeAuditReport report = auditor.auditRange(EntityKind.CUSTOMER, 0, 9, 100);

        List<Long> expectedMissing = LongStream.concat(LongStream.rangeClosed(501, 599), LongStream.rangeClosed(901, 1000))
                .boxed().collect(Collectors.toList());
        assertThat(report.getMissingFromDb()).containsExactlyElementsOf(expectedMissing);
        assertThat(report.getSummary().getMissingCount()).isEqualTo(199);
        assertThat(report.getSummary().getExtraCount()).isZero();
        assertThat(report.getExtraInDb()).isEmpty();
        assertThat(report.getSummary().getTotalApiRecords()).isEqualTo(1000);
        assertThat(report.getSummary().getTotalDbRecords()).isEqualTo(801);
        assertThat(report.getSummary().getMismatchCount()).isZero();
        assertThat(report.getPagesAudited()).hasSize(10);
    }

    @Test
    void rangeAuditRecordsFetchErrorsAndStopsAtAnEmptyPage() {
        sourceApi.customerPage(0, 1, 10)
                .failPage(1)
                .customerPage(2, 21, 10);
        stage(LongStream.rangeClosed(1, 10));

        RangeAuditReport report = auditor.auditRange(EntityKind.CUSTOMER, 0, 8, 10);

        assertThat(report.getApiErrors()).extracting(PageAuditError::getPage).containsExactly(1);
        assertThat(report.getPagesAudited()).extracting(PageAuditEntry::getPage).containsExactly(0, 2);
        assertThat(sourceApi.getRequestedPages()).containsExactly(0, 1, 2, 3);
        assertThat(report.getMissingFromDb()).hasSize(10).allMatch(id -> id >= 21 && id <= 30);
    }

    @Test
    void rangeAuditFlagsChangedPayloads() {
        sourceApi.customerPage(0, 1, 3);
        stage(LongStream.of(1, 3));
        ObjectNode stale = StubSourceApi.customer(2).put("email", "stale@example.com");
        stagingStore.put(EntityKind.CUSTOMER, StagingRecord.fromSource(EntityKind.CUSTOMER, stale, LocalDateTime.now()));

        RangeAuditReport report = auditor.auditRange(EntityKind.CUSTOMER, 0, 0, 3);

        assertThat(report.getDataMismatches()).singleElement().satisfies(issue -> {
            assertThat(issue.getIssue()).isEqualTo(DataIssue.DATA_MISMATCH);
            assertThat(issue.getId()).isEqualTo(2L);
            assertThat(issue.getDifferingFields()).containsExactly("email");
            assertThat(issue.getDbLabel()).isEqualTo("stale@example.com");
        });
        assertThat(report.getSummary().getMismatchCount()).isEqualTo(1);
    }

    @Test
    void rangeAuditRejectsAnInvertedRange() {
        assertThatThrownBy(() -> auditor.auditRange(EntityKind.CUSTOMER, 5, 2, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pageAuditClassifiesEveryRecord() {
        JsonNode noId = objectMapper.createObjectNode().put("email", "ghost@example.com");
        ObjectNode changed = StubSourceApi.customer(2).put("email", "old@example.com");
        sourceApi.page(0, List.of(StubSourceApi.customer(1), StubSourceApi.customer(2), StubSourceApi.customer(3),
                StubSourceApi.customer(4), noId), null);
        stage(LongStream.of(1, 4));
        stagingStore.put(EntityKind.CUSTOMER, StagingRecord.fromSource(EntityKind.CUSTOMER, changed, LocalDateTime.now()));
        stagingStore.overrideRawPayload(EntityKind.CUSTOMER, 4, "{not json");

        PageAuditReport report = auditor.auditPage(EntityKind.CUSTOMER, 0, 1000);

        assertThat(report.getApiCount()).isEqualTo(5);
        assertThat(report.getDbCount()).isEqualTo(3);
        assertThat(report.getPresentCount()).isEqualTo(1);
        assertThat(report.getMismatchCount()).isEqualTo(1);
        assertThat(report.getMissingCount()).isEqualTo(1);
        assertThat(report.getMissingRecords()).singleElement().satisfies(missing -> {
            assertThat(missing.getId()).isEqualTo(3L);
            assertThat(missing.getLabel()).isEqualTo("customer3@example.com");
            assertThat(missing.getSize()).isPositive();
        });
        assertThat(report.getDataIssues()).extracting(DataIssue::getIssue)
                .containsExactlyInAnyOrder(DataIssue.MISSING_NATURAL_ID, DataIssue.DATA_MISMATCH, DataIssue.INVALID_PAYLOAD);
        assertThat(report.getError()).isNull();
    }

    @Test
    void pageAuditReportsFetchFailureInsteadOfThrowing() {
        sourceApi.failPage(4);

        PageAuditReport report = auditor.auditPage(EntityKind.CUSTOMER, 4, 1000);

        assertThat(report.getError()).contains("500");
        assertThat(report.getApiCount()).isZero();
    }

    @Test
    void densityOverviewShowsTheSparseWindow() {
        stage(LongStream.rangeClosed(1, 500));
        stage(LongStream.rangeClosed(600, 900));

        List<DensityBucket> buckets = auditor.densityOverview(EntityKind.CUSTOMER, 100, 1);

        assertThat(buckets).hasSize(9);
        assertThat(buckets.get(0)).satisfies(b -> {
            assertThat(b.getPageRange()).isEqualTo("0-0");
            assertThat(b.getObservedCount()).isEqualTo(100);
            assertThat(b.getDelta()).isZero();
        });
        assertThat(buckets.get(5)).satisfies(b -> {
            assertThat(b.getWindowStartId()).isEqualTo(501);
            assertThat(b.getObservedCount()).isEqualTo(1);
            assertThat(b.getFirstId()).isEqualTo(600L);
            assertThat(b.getDelta()).isEqualTo(-99);
        });
        assertThat(buckets.stream().mapToLong(DensityBucket::getObservedCount).sum()).isEqualTo(801);
    }

    @Test
    void densityOverviewOfAnEmptyStoreIsEmpty() {
        assertThat(auditor.densityOverview(EntityKind.ORDER, 1000, 10)).isEmpty();
    }

    @Test
    void idGapsAreTheUnstagedIdsOfTheRange() {
        stage(LongStream.of(10, 11, 13, 15));

        assertThat(auditor.findIdGaps(EntityKind.CUSTOMER, 10, 15)).containsExactly(12L, 14L);
        assertThat(auditor.findIdGaps(EntityKind.CUSTOMER, 10, 11)).isEmpty();
        assertThatThrownBy(() -> auditor.findIdGaps(EntityKind.CUSTOMER, 5, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void idGapsReachTheLargestPossibleId() {
        stagingStore.put(EntityKind.CUSTOMER, StagingRecord.fromSource(EntityKind.CUSTOMER,
                StubSourceApi.customer(Long.MAX_VALUE - 1), LocalDateTime.now()));

        List<Long> gaps = assertTimeoutPreemptively(Duration.ofSeconds(3),
                () -> auditor.findIdGaps(EntityKind.CUSTOMER, Long.MAX_VALUE - 2, Long.MAX_VALUE));

        assertThat(gaps).containsExactly(Long.MAX_VALUE - 2, Long.MAX_VALUE);
    }

    @Test
    void idGapSpanThatOverflowsIsRejected() {
        assertThatThrownBy(() -> auditor.findIdGaps(EntityKind.CUSTOMER, Long.MIN_VALUE, Long.MAX_VALUE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rangeAuditAgainstAnEmptyStoreReportsEverySourceIdMissing() {
        sourceApi.customerPage(0, 1, 3);

        RangeAuditReport report = auditor.auditRange(EntityKind.CUSTOMER, 0, 0, 3);

        assertThat(report.getMissingFromDb()).containsExactly(1L, 2L, 3L);
        assertThat(report.getExtraInDb()).isEmpty();
        assertThat(report.getSummary().getTotalDbRecords()).isZero();
        assertThat(report.getSummary().getMissingCount()).isEqualTo(3);
    }

    @Test
    void exportWritesAnIndentedTimestampedReport(@TempDir Path directory) throws Exception {
        sourceApi.customerPage(0, 1, 2);
        RangeAuditReport report = auditor.auditRange(EntityKind.CUSTOMER, 0, 0, 2);

        Path file = auditor.exportReport(report, directory.resolve("reports"));

        assertThat(file.getFileName().toString()).matches("audit_report_\\d{8}_\\d{6}\\.json");
        String json = Files.readString(file);
        assertThat(json).contains("\"missing_from_db\"").contains("\n");
        assertThat(objectMapper.readTree(json).get("summary").get("missing_count").asInt()).isEqualTo(2);
    }

    private void stage(LongStream ids) {
        ids.forEach(id -> stagingStore.put(EntityKind.CUSTOMER,
                StagingRecord.fromSource(EntityKind.CUSTOMER, StubSourceApi.customer(id), LocalDateTime.now())));
    }
}
