package com.infomedia.abacox.storemigration.service;

import com.infomedia.abacox.storemigration.component.collection.CancellationToken;
import com.infomedia.abacox.storemigration.component.migration.MigrationOrchestrator;
import com.infomedia.abacox.storemigration.component.migration.MigrationOutcomeRecorder;
import com.infomedia.abacox.storemigration.component.migration.MigrationParams;
import com.infomedia.abacox.storemigration.component.migration.MigrationRunResult;
import com.infomedia.abacox.storemigration.dto.migration.MigrationJobStatus;
import com.infomedia.abacox.storemigration.dto.migration.MigrationStart;
import com.infomedia.abacox.storemigration.dto.migration.MigrationStats;
import com.infomedia.abacox.storemigration.exception.JobAlreadyRunningException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Service
@Log4j2
@RequiredArgsConstructor
public class MigrationJobService {

    private final MigrationOrchestrator orchestrator;
    private final MigrationOutcomeRecorder recorder;
    private final ExecutorService migrationExecutorService = Executors.newSingleThreadExecutor();

    // --- State Tracking ---
    private final AtomicBoolean isMigrationRunning = new AtomicBoolean(false);
    private final AtomicReference<JobState> currentState = new AtomicReference<>(JobState.IDLE);
    private final AtomicReference<CancellationToken> cancellationToken = new AtomicReference<>(new CancellationToken());
    private final AtomicReference<LocalDateTime> startTime = new AtomicReference<>();
    private final AtomicReference<LocalDateTime> endTime = new AtomicReference<>();
    private final AtomicReference<String> errorMessage = new AtomicReference<>();
    private final AtomicReference<Map<String, Object>> progress = new AtomicReference<>(Map.of());
    private final AtomicReference<MigrationRunResult> result = new AtomicReference<>();

    @Value("${store-migration.migration.pause-every:50}")
    private int pauseEvery;

    @Value("${store-migration.migration.pause-millis:1000}")
    private long pauseMillis;

    /**
     * Starts a migration run in the background.
     *
     * @throws JobAlreadyRunningException if a migration is already running
     */
    public void startAsync(MigrationStart request) {
        if (!isMigrationRunning.compareAndSet(false, true)) {
            throw new JobAlreadyRunningException("A customer migration is already in progress.");
        }

        MigrationParams params = MigrationParams.builder()
                .dryRun(request != null && Boolean.TRUE.equals(request.getDryRun()))
                .skipAlreadyMigrated(request == null || !Boolean.FALSE.equals(request.getSkipAlreadyMigrated()))
                .testLimit(request != null ? request.getTestLimit() : null)
                .pauseEvery(pauseEvery)
                .pauseMillis(pauseMillis)
                .build();

        resetState();
        log.info("Submitting migration task to executor service.");
        try {
            migrationExecutorService.submit(() -> run(params));
        } catch (RuntimeException e) {
            log.error("Failed to submit migration task to executor service", e);
            currentState.set(JobState.FAILED);
            errorMessage.set("Failed to start migration task: " + e.getMessage());
            endTime.set(LocalDateTime.now());
            isMigrationRunning.set(false);
        }
    }

    /**
     * Requests a stop; the run ends after the customer it is working on.
     */
    public boolean stop() {
        if (!isMigrationRunning.get()) {
            return false;
        }
        log.info("Stop requested for customer migration");
        cancellationToken.get().cancel();
        return true;
    }

    public MigrationJobStatus getStatus() {
        return MigrationJobStatus.builder()
                .state(currentState.get())
                .startTime(startTime.get())
                .endTime(endTime.get())
                .errorMessage(errorMessage.get())
                .progress(progress.get())
                .result(result.get())
                .build();
    }

    public MigrationStats getStats() {
        return recorder.getStats();
    }

    public long resetStatuses() {
        if (isMigrationRunning.get()) {
            throw new JobAlreadyRunningException("Cannot reset migration statuses while a migration is in progress.");
        }
        return recorder.resetStatuses();
    }

    private void resetState() {
        currentState.set(JobState.STARTING);
        cancellationToken.set(new CancellationToken());
        startTime.set(LocalDateTime.now());
        endTime.set(null);
        errorMessage.set(null);
        progress.set(Map.of());
        result.set(null);
    }

    private void run(MigrationParams params) {
        currentState.set(JobState.RUNNING);
        log.info("<<<<<<<<<< Starting Customer Migration Execution >>>>>>>>>>");
        try {
            MigrationRunResult runResult = orchestrator.run(params, cancellationToken.get(), progress::set);
            result.set(runResult);
            currentState.set(runResult.isStopped() ? JobState.STOPPED : JobState.COMPLETED);
        } catch (RuntimeException e) {
            log.error("<<<<<<<<<< Customer Migration FAILED during execution >>>>>>>>>>", e);
            currentState.set(JobState.FAILED);
            errorMessage.set("Migration failed: " + e.getMessage());
        } finally {
            endTime.set(LocalDateTime.now());
            isMigrationRunning.set(false);
            log.info("Migration process ended. State: {}, Duration: {}", currentState.get(),
                    Duration.between(startTime.get(), endTime.get()));
        }
    }

    @PreDestroy
    public void shutdown() {
        cancellationToken.get().cancel();
        migrationExecutorService.shutdownNow();
    }
}
