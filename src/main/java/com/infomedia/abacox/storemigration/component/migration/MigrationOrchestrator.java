package com.infomedia.abacox.storemigration.component.migration;

import com.infomedia.abacox.storemigration.component.collection.CancellationToken;
import com.infomedia.abacox.storemigration.component.collection.ProgressListener;
import com.infomedia.abacox.storemigration.component.mapping.ProductCatalog;
import com.infomedia.abacox.storemigration.component.ratelimit.TimeSource;
import com.infomedia.abacox.storemigration.component.staging.StagingStore;
import com.infomedia.abacox.storemigration.db.entity.MigrationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Migrates every eligible staged customer, one unit at a time. A failing unit is recorded and
 * the run moves on; cancellation is honoured between units.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class MigrationOrchestrator {

    private final StagingStore stagingStore;
    private final MigrationUnitAssembler assembler;
    private final CustomerMigrationExecutor executor;
    private final MigrationOutcomeRecorder recorder;
    private final ProductCatalog productCatalog;
    private final TimeSource timeSource;

    public MigrationRunResult run(MigrationParams params, CancellationToken cancellationToken,
                                  ProgressListener progressListener) {
        ProgressListener listener = progressListener != null ? progressListener : ProgressListener.NONE;
        CancellationToken token = cancellationToken != null ? cancellationToken : CancellationToken.none();
        boolean dryRun = params.isDryRun();

        log.info("=== Starting customer migration{} ===", dryRun ? " (dry run, no changes will be made)" : "");
        report(listener, Map.of("stage", "preparation", "status", "Building product catalogue"));
        productCatalog.refresh();

        List<Long> eligible = stagingStore.findEligibleCustomerIds(params.getTestLimit());
        Set<Long> alreadyMigrated = params.isSkipAlreadyMigrated()
                ? recorder.findMigratedCustomerIds(eligible)
                : Set.of();
        log.info("Found {} eligible customers, {} already migrated", eligible.size(), alreadyMigrated.size());

        MigrationRunResult result = MigrationRunResult.builder().dryRun(dryRun).build();
        int total = eligible.size();
        int position = 0;

        for (Long customerId : eligible) {
            if (token.isCancelled()) {
                result.setStopped(true);
                log.info("Migration stopped after {} of {} customers", position, total);
                break;
            }
            position++;

            if (alreadyMigrated.contains(customerId)) {
                result.setSkipped(result.getSkipped() + 1);
                continue;
            }

            UnitOutcome outcome = migrateUnit(customerId, dryRun);
            result.getOutcomes().add(outcome);
            if (outcome.getStatus() == MigrationStatus.SUCCESS) {
                result.setMigrated(result.getMigrated() + 1);
            } else {
                result.setFailed(result.getFailed() + 1);
            }
            result.setOrdersMigrated(result.getOrdersMigrated() + outcome.getOrdersMigrated());
            result.setOrdersFailed(result.getOrdersFailed() + outcome.getOrdersFailed());
            result.setTotalProcessed(result.getMigrated() + result.getFailed());

            if (!dryRun) {
                recorder.record(outcome);
            }

            Map<String, Object> status = new LinkedHashMap<>();
            status.put("stage", "migration");
            status.put("current", position);
            status.put("total", total);
            status.put("customerEmail", outcome.getEmail() != null ? outcome.getEmail() : "unknown");
            status.put("migrated", result.getMigrated());
            status.put("failed", result.getFailed());
            status.put("skipped", result.getSkipped());
            report(listener, status);

            if (params.getPauseEvery() > 0 && position % params.getPauseEvery() == 0) {
                log.info("Processed {}/{} customers: {} migrated, {} failed", position, total,
                        result.getMigrated(), result.getFailed());
                if (!dryRun && !pause(params.getPauseMillis())) {
                    result.setStopped(true);
                    break;
                }
            }
        }

        log.info("Migration finished: {} migrated, {} failed, {} skipped, {} orders migrated, {} orders failed{}",
                result.getMigrated(), result.getFailed(), result.getSkipped(), result.getOrdersMigrated(),
                result.getOrdersFailed(), result.isStopped() ? " (stopped)" : "");
        return result;
    }

    private UnitOutcome migrateUnit(long customerId, boolean dryRun) {
        try {
            Optional<MigrationUnit> unit = assembler.assemble(customerId);
            if (unit.isEmpty()) {
                return UnitOutcome.failed(customerId, null, "Customer not found in staging", dryRun);
            }
            return executor.migrate(unit.get(), dryRun);
        } catch (RuntimeException e) {
            log.error("Failed to migrate customer {}: {}", customerId, e.getMessage(), e);
            return UnitOutcome.failed(customerId, null, e.getMessage(), dryRun);
        }
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

    private static void report(ProgressListener listener, Map<String, Object> status) {
        try {
            listener.onProgress(status);
        } catch (RuntimeException e) {
            log.error("Error executing migration progress callback", e);
        }
    }
}
