package com.infomedia.abacox.storemigration.service;

import com.infomedia.abacox.storemigration.component.collection.CancellationToken;
import com.infomedia.abacox.storemigration.component.collection.CollectionAbortedException;
import com.infomedia.abacox.storemigration.component.collection.CollectionParams;
import com.infomedia.abacox.storemigration.component.collection.CollectionResult;
import com.infomedia.abacox.storemigration.component.collection.CollectionState;
import com.infomedia.abacox.storemigration.component.collection.PaginatedCollector;
import com.infomedia.abacox.storemigration.component.collection.StagingBatchCommitException;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.component.staging.StagingStore;
import com.infomedia.abacox.storemigration.dto.collection.CollectionStart;
import com.infomedia.abacox.storemigration.dto.collection.CollectionStatus;
import com.infomedia.abacox.storemigration.dto.collection.StagingStats;
import com.infomedia.abacox.storemigration.exception.JobAlreadyRunningException;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Runs collections in the background, at most one per entity kind at a time. Different kinds
 * may run side by side; each kind has its own single-thread executor.
 */
@Service
@Log4j2
public class CollectionJobService {

    private final PaginatedCollector collector;
    private final StagingStore stagingStore;
    private final Map<EntityKind, CollectionJob> jobs = new EnumMap<>(EntityKind.class);

    @Value("${store-migration.collection.page-size:1000}")
    private int defaultPageSize;

    @Value("${store-migration.collection.progress-every:100}")
    private int progressEvery;

    @Value("${store-migration.collection.max-consecutive-failures:10}")
    private int maxConsecutiveFailures;

    @Value("${store-migration.collection.pause-between-pages-millis:200}")
    private long defaultPauseMillis;

    public CollectionJobService(PaginatedCollector collector, StagingStore stagingStore) {
        this.collector = collector;
        this.stagingStore = stagingStore;
        for (EntityKind kind : EntityKind.values()) {
            jobs.put(kind, new CollectionJob(kind));
        }
    }

    public void startAsync(EntityKind kind, CollectionStart request) {
        CollectionJob job = jobs.get(kind);
        if (!job.running.compareAndSet(false, true)) {
            throw new JobAlreadyRunningException("A " + kind.name().toLowerCase() + " collection is already in progress.");
        }

        CollectionParams params = CollectionParams.builder()
                .kind(kind)
                .startPage(request != null && request.getStartPage() != null ? request.getStartPage() : 0)
                .pageSize(request != null && request.getPageSize() != null ? request.getPageSize() : defaultPageSize)
                .progressEvery(progressEvery)
                .maxConsecutiveFailures(maxConsecutiveFailures)
                .pauseBetweenPagesMillis(request != null && request.getPauseBetweenPagesMillis() != null
                        ? request.getPauseBetweenPagesMillis() : defaultPauseMillis)
                .build();

        job.reset();
        log.info("Submitting {} collection task to executor service.", kind);
        try {
            job.executor.submit(() -> run(job, params));
        } catch (RuntimeException e) {
            log.error("Failed to submit {} collection task", kind, e);
            job.state.set(JobState.FAILED);
            job.errorMessage.set("Failed to start collection task: " + e.getMessage());
            job.endTime.set(LocalDateTime.now());
            job.running.set(false);
        }
    }

    /**
     * Requests a stop; the run ends after the page it is working on.
     *
     * @return false when no collection of that kind is running
     */
    public boolean stop(EntityKind kind) {
        CollectionJob job = jobs.get(kind);
        if (!job.running.get()) {
            return false;
        }
        log.info("Stop requested for {} collection", kind);
        job.token.get().cancel();
        return true;
    }

    public CollectionStatus getStatus(EntityKind kind) {
        CollectionJob job = jobs.get(kind);
        return CollectionStatus.builder()
                .kind(kind)
                .state(job.state.get())
                .startTime(job.startTime.get())
                .endTime(job.endTime.get())
                .errorMessage(job.errorMessage.get())
                .progress(job.progress.get())
                .result(job.result.get())
                .build();
    }

    public List<StagingStats> getStagingStats() {
        return Arrays.stream(EntityKind.values())
                .map(kind -> StagingStats.builder()
                        .kind(kind)
                        .count(stagingStore.count(kind))
                        .distinctOwners(stagingStore.countDistinctOwners(kind))
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Wipes every staged record of a kind. Refused while that kind is being collected.
     */
    public long deleteStaged(EntityKind kind) {
        if (jobs.get(kind).running.get()) {
            throw new JobAlreadyRunningException("Cannot delete staged " + kind.name().toLowerCase()
                    + " records while their collection is in progress.");
        }
        return stagingStore.deleteAll(kind);
    }

    private void run(CollectionJob job, CollectionParams params) {
        job.state.set(JobState.RUNNING);
        log.info("<<<<<<<<<< Starting {} collection >>>>>>>>>>", job.kind);
        try {
            CollectionResult result = collector.collect(params, job.token.get(), job.progress::set);
            job.result.set(result);
            job.state.set(result.getState() == CollectionState.STOPPED ? JobState.STOPPED : JobState.COMPLETED);
        } catch (CollectionAbortedException e) {
            fail(job, e.getMessage(), e.getPartialResult(), e);
        } catch (StagingBatchCommitException e) {
            fail(job, e.getMessage(), e.getPartialResult(), e);
        } catch (RuntimeException e) {
            fail(job, e.getMessage(), null, e);
        } finally {
            job.endTime.set(LocalDateTime.now());
            job.running.set(false);
            log.info("{} collection ended. State: {}, Duration: {}", job.kind, job.state.get(),
                    Duration.between(job.startTime.get(), job.endTime.get()));
        }
    }

    private static void fail(CollectionJob job, String message, CollectionResult partial, Exception e) {
        log.error("<<<<<<<<<< {} collection FAILED >>>>>>>>>>", job.kind, e);
        job.state.set(JobState.FAILED);
        job.errorMessage.set("Collection failed: " + message);
        job.result.set(partial);
    }

    @PreDestroy
    public void shutdown() {
        jobs.values().forEach(job -> {
            job.token.get().cancel();
            job.executor.shutdownNow();
        });
    }

    private static final class CollectionJob {
        private final EntityKind kind;
        private final ExecutorService executor = Executors.newSingleThreadExecutor();
        private final AtomicBoolean running = new AtomicBoolean(false);
        private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);
        private final AtomicReference<CancellationToken> token = new AtomicReference<>(new CancellationToken());
        private final AtomicReference<LocalDateTime> startTime = new AtomicReference<>();
        private final AtomicReference<LocalDateTime> endTime = new AtomicReference<>();
        private final AtomicReference<String> errorMessage = new AtomicReference<>();
        private final AtomicReference<Map<String, Object>> progress = new AtomicReference<>(Map.of());
        private final AtomicReference<CollectionResult> result = new AtomicReference<>();

        private CollectionJob(EntityKind kind) {
            this.kind = kind;
        }

        private void reset() {
            state.set(JobState.STARTING);
            token.set(new CancellationToken());
            startTime.set(LocalDateTime.now());
            endTime.set(null);
            errorMessage.set(null);
            progress.set(Map.of());
            result.set(null);
        }
    }
}
