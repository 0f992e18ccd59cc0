package com.infomedia.abacox.storemigration.component.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.infomedia.abacox.storemigration.component.sourceapi.SourceApi;
import com.infomedia.abacox.storemigration.component.sourceapi.SourcePage;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.component.staging.StagingStore;
import com.infomedia.abacox.storemigration.exception.SourceApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares what the source API reports with what the staging store holds. Never writes to
 * either side.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class StagingAuditor {

    private static final DateTimeFormatter REPORT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_DENSITY_WINDOWS = 100_000;
    private static final long MAX_GAP_SPAN = 10_000_000L;

    private final SourceApi sourceApi;
    private final StagingStore stagingStore;
    private final ObjectMapper objectMapper;

    @Value("${store-migration.audit.missing-list-limit:50}")
    private int missingListLimit = 50;

    /**
     * Re-fetches one page and classifies every record on it as present, present with a
     * mismatching payload, or missing.
     */
    public PageAuditReport auditPage(EntityKind kind, int page, int pageSize) {
        log.info("Detailed audit of {} page {}", kind, page);
        SourcePage sourcePage;
        try {
            sourcePage = sourceApi.fetchPage(kind, page, pageSize);
        } catch (SourceApiException e) {
            log.error("Failed to audit {} page {}: {}", kind, page, e.getMessage());
            return PageAuditReport.builder().kind(kind).page(page).error(e.getMessage()).build();
        }

        PageAuditReport report = PageAuditReport.builder()
                .kind(kind)
                .page(page)
                .apiCount(sourcePage.getResults().size())
                .build();

        Map<Long, JsonNode> apiRecords = new LinkedHashMap<>();
        for (JsonNode node : sourcePage.getResults()) {
            OptionalLong id = kind.naturalId(node);
            if (id.isEmpty()) {
                report.getDataIssues().add(DataIssue.builder()
                        .issue(DataIssue.MISSING_NATURAL_ID)
                        .apiLabel(kind.label(node))
                        .detail(abbreviate(node.toString()))
                        .build());
                continue;
            }
            apiRecords.put(id.getAsLong(), node);
        }

        Map<Long, String> stored = stagingStore.findRawPayloads(kind, apiRecords.keySet());
        for (Map.Entry<Long, JsonNode> entry : apiRecords.entrySet()) {
            Long id = entry.getKey();
            JsonNode apiNode = entry.getValue();
            String raw = stored.get(id);
            if (raw == null) {
                report.setMissingCount(report.getMissingCount() + 1);
                if (report.getMissingRecords().size() < missingListLimit) {
                    report.getMissingRecords().add(MissingRecord.builder()
                            .id(id)
                            .label(kind.label(apiNode))
                            .size(apiNode.toString().getBytes(StandardCharsets.UTF_8).length)
                            .hasId(true)
                            .build());
                }
                continue;
            }
            report.setDbCount(report.getDbCount() + 1);
            DataIssue issue = compare(kind, id, apiNode, raw);
            if (issue == null) {
                report.setPresentCount(report.getPresentCount() + 1);
            } else {
                if (DataIssue.DATA_MISMATCH.equals(issue.getIssue())) {
                    report.setMismatchCount(report.getMismatchCount() + 1);
                }
                report.getDataIssues().add(issue);
            }
        }

        log.info("{} page {} audit: api={}, db={}, missing={}, issues={}", kind, page,
                report.getApiCount(), report.getDbCount(), report.getMissingCount(), report.getDataIssues().size());
        return report;
    }

    /**
     * Audits pages {@code startPage..endPage} inclusive. A page that fails to fetch is recorded and
     * skipped; an empty page ends the range early.
     */
    public RangeAuditReport auditRange(EntityKind kind, int startPage, int endPage, int pageSize) {
        if (endPage < startPage) {
            throw new IllegalArgumentException("endPage " + endPage + " is before startPage " + startPage);
        }
        log.info("Starting {} audit of pages {} to {}", kind, startPage, endPage);

        RangeAuditReport report = RangeAuditReport.builder()
                .kind(kind)
                .startPage(startPage)
                .endPage(endPage)
                .generatedAt(LocalDateTime.now())
                .build();
        Map<Long, JsonNode> expected = new LinkedHashMap<>();
        long totalApiRecords = 0;

        for (int page = startPage; page <= endPage; page++) {
            SourcePage sourcePage;
            try {
                sourcePage = sourceApi.fetchPage(kind, page, pageSize);
            } catch (SourceApiException e) {
                log.error("Failed to fetch {} page {}: {}", kind, page, e.getMessage());
                report.getApiErrors().add(new PageAuditError(page, e.getMessage()));
                continue;
            }
            if (sourcePage.isEmpty()) {
                log.warn("No {} records returned for page {}, ending range", kind, page);
                break;
            }

            Set<Long> pageIds = new LinkedHashSet<>();
            for (JsonNode node : sourcePage.getResults()) {
                OptionalLong id = kind.naturalId(node);
                if (id.isPresent()) {
                    pageIds.add(id.getAsLong());
                    expected.put(id.getAsLong(), node);
                }
            }
            totalApiRecords += sourcePage.getResults().size();
            report.getPagesAudited().add(PageAuditEntry.builder()
                    .page(page)
                    .apiCount(sourcePage.getResults().size())
                    .ids(new ArrayList<>(pageIds))
                    .build());
            log.debug("{} page {}: {} records from API", kind, page, sourcePage.getResults().size());
        }

        Set<Long> actual = stagingStore.containsAny(kind, expected.keySet());
        Reconciliation reconciliation = Reconciliation.of(expected.keySet(), actual);
        report.setMissingFromDb(new ArrayList<>(reconciliation.getMissing()));
        report.setExtraInDb(new ArrayList<>(reconciliation.getExtra()));

        Map<Long, String> stored = stagingStore.findRawPayloads(kind, actual);
        for (Long id : actual) {
            String raw = stored.get(id);
            DataIssue issue = raw == null ? null : compare(kind, id, expected.get(id), raw);
            if (issue != null) {
                report.getDataMismatches().add(issue);
            }
        }

        report.setSummary(AuditSummary.builder()
                .totalApiRecords(totalApiRecords)
                .totalDbRecords(actual.size())
                .missingCount(reconciliation.getMissing().size())
                .extraCount(reconciliation.getExtra().size())
                .mismatchCount(report.getDataMismatches().size())
                .build());

        log.info("{} range audit complete: {} missing, {} extra, {} mismatched, {} page errors", kind,
                reconciliation.getMissing().size(), reconciliation.getExtra().size(),
                report.getDataMismatches().size(), report.getApiErrors().size());
        return report;
    }

    /**
     * Buckets staged ids into consecutive id windows of {@code pageSize * pagesPerChunk}, starting at
     * the lowest staged id, without calling the source API.
     */
    public List<DensityBucket> densityOverview(EntityKind kind, int pageSize, int pagesPerChunk) {
        if (pageSize < 1 || pagesPerChunk < 1) {
            throw new IllegalArgumentException("pageSize and pagesPerChunk must be positive");
        }
        List<Long> ids = stagingStore.findAllNaturalIds(kind);
        if (ids.isEmpty()) {
            return List.of();
        }

        long width = (long) pageSize * pagesPerChunk;
        long minId = ids.get(0);
        long maxId = ids.get(ids.size() - 1);
        long windows = (maxId - minId) / width + 1;
        if (windows > MAX_DENSITY_WINDOWS) {
            throw new IllegalArgumentException("Staged ids span " + windows
                    + " windows; use a larger pageSize or pagesPerChunk");
        }

        List<DensityBucket> buckets = new ArrayList<>((int) windows);
        Iterator<Long> iterator = ids.iterator();
        Long next = iterator.next();
        for (long index = 0; index < windows; index++) {
            long windowStart = minId + index * width;
            long windowEnd = windowStart + width - 1;
            long observed = 0;
            Long first = null;
            Long last = null;
            while (next != null && next <= windowEnd) {
                if (first == null) {
                    first = next;
                }
                last = next;
                observed++;
                next = iterator.hasNext() ? iterator.next() : null;
            }
            long expectedCount = Math.min(width, maxId - windowStart + 1);
            long startPage = index * pagesPerChunk;
            buckets.add(DensityBucket.builder()
                    .pageRange(startPage + "-" + (startPage + pagesPerChunk - 1))
                    .firstId(first)
                    .lastId(last)
                    .windowStartId(windowStart)
                    .windowEndId(windowEnd)
                    .observedCount(observed)
                    .expectedCount(expectedCount)
                    .delta(observed - expectedCount)
                    .build());
        }
        return buckets;
    }

    /**
     * Ids in {@code startId..endId} inclusive that are not staged, ascending.
     */
    public List<Long> findIdGaps(EntityKind kind, long startId, long endId) {
        if (endId < startId) {
            throw new IllegalArgumentException("endId " + endId + " is before startId " + startId);
        }
        long span = endId - startId;
        // a negative span means the subtraction overflowed
        if (span < 0 || span >= MAX_GAP_SPAN) {
            throw new IllegalArgumentException("Id range is limited to " + MAX_GAP_SPAN + " ids");
        }
        Set<Long> existing = new TreeSet<>(stagingStore.findNaturalIdsBetween(kind, startId, endId));
        List<Long> gaps = new ArrayList<>();
        for (long offset = 0; offset <= span; offset++) {
            long id = startId + offset;
            if (!existing.contains(id)) {
                gaps.add(id);
            }
        }
        return gaps;
    }

    /**
     * Writes a report as indented JSON into {@code directory} under a timestamped file name.
     */
    public Path exportReport(Object report, Path directory) {
        Path file = directory.resolve("audit_report_" + LocalDateTime.now().format(REPORT_TIMESTAMP) + ".json");
        try {
            Files.createDirectories(directory);
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(file.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export audit report to " + file, e);
        }
        log.info("Audit report exported to {}", file);
        return file;
    }

    private DataIssue compare(EntityKind kind, Long id, JsonNode apiNode, String raw) {
        JsonNode dbNode;
        try {
            dbNode = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return DataIssue.builder()
                    .issue(DataIssue.INVALID_PAYLOAD)
                    .id(id)
                    .detail(e.getOriginalMessage())
                    .build();
        }
        if (dbNode == null || !dbNode.isObject()) {
            return DataIssue.builder().issue(DataIssue.INVALID_PAYLOAD).id(id).detail("Stored payload is not an object").build();
        }
        if (dbNode.equals(apiNode)) {
            return null;
        }
        return DataIssue.builder()
                .issue(DataIssue.DATA_MISMATCH)
                .id(id)
                .differingFields(differingFields(apiNode, dbNode))
                .apiLabel(kind.label(apiNode))
                .dbLabel(kind.label(dbNode))
                .build();
    }

    private static List<String> differingFields(JsonNode apiNode, JsonNode dbNode) {
        Set<String> names = new TreeSet<>();
        apiNode.fieldNames().forEachRemaining(names::add);
        dbNode.fieldNames().forEachRemaining(names::add);
        List<String> differing = new ArrayList<>();
        for (String name : names) {
            if (!Objects.equals(apiNode.get(name), dbNode.get(name))) {
                differing.add(name);
            }
        }
        return differing;
    }

    private static String abbreviate(String value) {
        return value.length() > 500 ? value.substring(0, 500) + "..." : value;
    }
}
