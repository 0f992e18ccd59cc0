package com.infomedia.abacox.storemigration.component.collection;

import com.fasterxml.jackson.databind.JsonNode;
import com.infomedia.abacox.storemigration.component.ratelimit.TimeSource;
import com.infomedia.abacox.storemigration.component.sourceapi.SourceApi;
import com.infomedia.abacox.storemigration.component.sourceapi.SourcePage;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.component.staging.InvalidRecordException;
import com.infomedia.abacox.storemigration.component.staging.StagingRecord;
import com.infomedia.abacox.storemigration.component.staging.StagingStore;
import com.infomedia.abacox.storemigration.exception.SourceApiException;
import com.infomedia.abacox.storemigration.exception.StagingWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Drives the page loop of one entity kind from the source API into the staging store.
 * <p>
 * The {@code next} link of each page decides the following page; when it cannot be parsed the
 * loop moves to {@code page + 1}, which may skip or repeat a page if the source shifted in
 * between. Range audits detect that drift.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class PaginatedCollector {

    private final SourceApi sourceApi;
    private final StagingStore stagingStore;
    private final TimeSource timeSource;

    public CollectionResult collect(CollectionParams params, CancellationToken cancellationToken,
                                    ProgressListener progressListener) {
        EntityKind kind = params.getKind();
        ProgressListener listener = progressListener != null ? progressListener : ProgressListener.NONE;
        CancellationToken token = cancellationToken != null ? cancellationToken : CancellationToken.none();
        Run run = new Run(kind, params.getStartPage(), listener);

        log.info("Starting {} collection from page {} (page size {})", kind, params.getStartPage(), params.getPageSize());

        while (true) {
            if (token.isCancelled()) {
                run.state = CollectionState.STOPPED;
                log.info("{} collection stopped at page {}", kind, run.page);
                break;
            }

            run.state = CollectionState.FETCHING;
            SourcePage sourcePage;
            try {
                sourcePage = sourceApi.fetchPage(kind, run.page, params.getPageSize());
                run.pagesFetched++;
            } catch (SourceApiException e) {
                run.state = CollectionState.PAGE_ERROR;
                run.failed += params.getPageSize();
                run.consecutiveFailures++;
                log.error("Failed to fetch {} page {} ({} consecutive failures): {}",
                        kind, run.page, run.consecutiveFailures, e.getMessage());
                if (run.consecutiveFailures > params.getMaxConsecutiveFailures()) {
                    run.state = CollectionState.ABORTED;
                    run.report();
                    throw new CollectionAbortedException("Aborting " + kind + " collection after "
                            + run.consecutiveFailures + " consecutive page failures", run.toResult(), e);
                }
                run.page++;
                run.report();
                continue;
            }
            run.consecutiveFailures = 0;

            if (sourcePage.isEmpty()) {
                run.state = CollectionState.PAGE_EMPTY;
                log.info("{} page {} is empty, source exhausted", kind, run.page);
                run.state = CollectionState.DONE;
                break;
            }

            run.state = CollectionState.PAGE_OK;
            if (sourcePage.getCount() != null) {
                run.sourceCount = sourcePage.getCount();
            }
            stagePage(params, run, sourcePage);
            run.report();

            if (!sourcePage.hasNext()) {
                log.info("{} page {} has no next link, collection complete", kind, run.page);
                run.state = CollectionState.DONE;
                break;
            }

            run.state = CollectionState.CONTINUE;
            OptionalInt nextPage = PageCursorParser.parseNextPage(sourcePage.getNext());
            if (nextPage.isPresent() && nextPage.getAsInt() > run.page) {
                run.page = nextPage.getAsInt();
            } else if (nextPage.isPresent()) {
                log.warn("Next link '{}' does not move past page {}, falling back to page {}",
                        sourcePage.getNext(), run.page, run.page + 1);
                run.page++;
            } else {
                log.warn("Could not parse page number from next link '{}', falling back to page {}",
                        sourcePage.getNext(), run.page + 1);
                run.page++;
            }

            if (!pause(params.getPauseBetweenPagesMillis())) {
                run.state = CollectionState.STOPPED;
                log.info("{} collection interrupted at page {}", kind, run.page);
                break;
            }
        }

        run.report();
        CollectionResult result = run.toResult();
        log.info("{} collection finished: state={}, collected={}, failed={}, finalPage={}",
                kind, result.getState(), result.getCollected(), result.getFailed(), result.getFinalPage());
        return result;
    }

    private void stagePage(CollectionParams params, Run run, SourcePage sourcePage) {
        EntityKind kind = run.kind;
        LocalDateTime fetchedAt = LocalDateTime.now();
        List<StagingRecord> records = new ArrayList<>(sourcePage.getResults().size());
        long pageFailed = 0;
        int processed = 0;

        for (JsonNode node : sourcePage.getResults()) {
            try {
                records.add(StagingRecord.fromSource(kind, node, fetchedAt));
            } catch (InvalidRecordException e) {
                pageFailed++;
                log.warn("Skipping {} record on page {}: {}", kind, run.page, e.getMessage());
            }
            processed++;
            if (params.getProgressEvery() > 0 && processed % params.getProgressEvery() == 0) {
                run.report(Map.of("pageProcessed", processed, "pageTotal", sourcePage.getResults().size()));
            }
        }

        try {
            stagingStore.upsertBatch(kind, records);
        } catch (StagingWriteException e) {
            run.failed += sourcePage.getResults().size();
            run.state = CollectionState.ABORTED;
            log.error("Failed to commit {} page {}", kind, run.page, e);
            run.report();
            throw new StagingBatchCommitException("Failed to commit " + kind + " page " + run.page,
                    run.toResult(), e);
        }

        run.collected += records.size();
        run.failed += pageFailed;
        log.debug("Staged {} page {}: {} records, {} skipped", kind, run.page, records.size(), pageFailed);
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            timeSource.sleep(Duration.ofMillis(millis));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class Run {
        private final EntityKind kind;
        private final ProgressListener listener;
        private int page;
        private long collected;
        private long failed;
        private int pagesFetched;
        private int consecutiveFailures;
        private Long sourceCount;
        private CollectionState state = CollectionState.IDLE;

        private Run(EntityKind kind, int startPage, ProgressListener listener) {
            this.kind = kind;
            this.page = startPage;
            this.listener = listener;
        }

        private CollectionResult toResult() {
            return CollectionResult.builder()
                    .kind(kind)
                    .collected(collected)
                    .failed(failed)
                    .finalPage(page)
                    .state(state)
                    .pagesFetched(pagesFetched)
                    .build();
        }

        private void report() {
            report(Map.of());
        }

        private void report(Map<String, Object> extra) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("kind", kind.name());
            status.put("state", state.name());
            status.put("page", page);
            status.put("collected", collected);
            status.put("failed", failed);
            status.put("pagesFetched", pagesFetched);
            status.put("consecutiveFailures", consecutiveFailures);
            if (sourceCount != null) {
                status.put("sourceCount", sourceCount);
            }
            status.putAll(extra);
            try {
                listener.onProgress(status);
            } catch (RuntimeException e) {
                log.error("Error executing progress callback for {} collection", kind, e);
            }
        }
    }
}
