package com.di.qualitygate.batch;

import com.di.qualitygate.exception.ErrorCategory;
import com.di.qualitygate.gate.EntityProcessingException;
import com.di.qualitygate.gate.GateResult;
import com.di.qualitygate.gate.QualityGate;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.store.QuarantineSink;
import com.di.qualitygate.util.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs a full bronze → silver batch.
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │  clear quarantine                                            │
 * ├──────────────────────────────────────────────────────────────┤
 * │  for each entity, in {@link SourceEntity} order:             │
 * │     QualityGate.process  (read, cleanse, publish)            │
 * │     on failure: FAILED, remaining entities SKIPPED           │
 * ├──────────────────────────────────────────────────────────────┤
 * │  COMPLETED | FAILED, summary logged, metrics kept as latest  │
 * └──────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>One run at a time. Failures are reported in the returned metrics, never
 * thrown; the only exception is {@link BatchAlreadyRunningException}.
 */
@Service
@Slf4j
public class BatchRunOrchestrator {

    static final String MDC_RUN_ID = "runId";

    private final QualityGate qualityGate;
    private final QuarantineSink quarantineSink;
    private final MetricsCollector metrics;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicReference<BatchRunMetrics> latestRun = new AtomicReference<>();
    private volatile BatchState state = BatchState.IDLE;
    private volatile String currentRunId;
    private volatile SourceEntity currentEntity;

    public BatchRunOrchestrator(QualityGate qualityGate,
                                QuarantineSink quarantineSink,
                                MetricsCollector metrics,
                                Clock clock) {
        this.qualityGate = qualityGate;
        this.quarantineSink = quarantineSink;
        this.metrics = metrics;
        this.clock = clock;
    }

    /* ==================================================================== */
    /* Entry point                                                           */
    /* ==================================================================== */

    /**
     * Runs the six entities synchronously and returns once the run is
     * COMPLETED or FAILED.
     *
     * @throws BatchAlreadyRunningException if another run holds the lock
     */
    public BatchRunMetrics runBatch() {
        if (!runLock.tryLock()) {
            metrics.recordRefusedBatch();
            throw new BatchAlreadyRunningException(currentRunId);
        }
        String runId = UUID.randomUUID().toString();
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_RUN_ID, runId)) {
            currentRunId = runId;
            state = BatchState.RUNNING;
            BatchRunMetrics result = execute(runId);
            state = result.getState();
            latestRun.set(result);
            metrics.recordBatch(result.getState(), result.getDurationMs());
            logSummary(result);
            return result;
        } finally {
            currentRunId = null;
            currentEntity = null;
            runLock.unlock();
        }
    }

    public BatchState getState() {
        return state;
    }

    /** State plus the run id and the entity being processed while RUNNING. */
    public BatchStatus getStatus() {
        return BatchStatus.builder()
                .state(state)
                .runId(currentRunId)
                .currentEntity(currentEntity)
                .build();
    }

    public Optional<BatchRunMetrics> getLatestRun() {
        return Optional.ofNullable(latestRun.get());
    }

    /* ==================================================================== */
    /* Internal                                                              */
    /* ==================================================================== */

    private BatchRunMetrics execute(String runId) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        log.info("[BATCH] runId={} started", runId);

        List<EntityRunMetrics> entityMetrics = new ArrayList<>();
        SourceEntity failedEntity = null;
        Throwable failure = null;

        try {
            quarantineSink.clear();
        } catch (RuntimeException e) {
            log.error("[BATCH] runId={} could not clear the quarantine: {}", runId, e.getMessage(), e);
            failure = e;
        }

        for (SourceEntity entity : SourceEntity.values()) {
            if (failure != null) {
                entityMetrics.add(EntityRunMetrics.skipped(entity));
                continue;
            }
            currentEntity = entity;
            long entityStart = System.nanoTime();
            try {
                GateResult result = qualityGate.process(entity, startedAt);
                long durationMs = elapsedMs(entityStart);
                entityMetrics.add(EntityRunMetrics.builder()
                        .entity(entity)
                        .status(EntityStatus.SUCCEEDED)
                        .sourceRows(result.getSourceCount())
                        .acceptedRows(result.getAcceptedCount())
                        .rejectedRows(result.rejectedCount())
                        .rejectedByReason(result.getRejectedByReason())
                        .durationMs(durationMs)
                        .build());
                metrics.recordEntityRows(entity, result.getSourceCount(), result.getAcceptedCount(), result.getRejectedByReason());
                metrics.recordEntityDuration(entity, EntityStatus.SUCCEEDED, durationMs);
            } catch (EntityProcessingException e) {
                long durationMs = elapsedMs(entityStart);
                log.error("[BATCH] runId={} entity={} FAILED: {}", runId, entity, e.getMessage(), e);
                failedEntity = entity;
                failure = e;
                entityMetrics.add(EntityRunMetrics.builder()
                        .entity(entity)
                        .status(EntityStatus.FAILED)
                        .durationMs(durationMs)
                        .failureMessage(e.getMessage())
                        .build());
                metrics.recordEntityDuration(entity, EntityStatus.FAILED, durationMs);
            }
        }

        currentEntity = null;

        BatchRunMetrics.BatchRunMetricsBuilder result = BatchRunMetrics.builder()
                .runId(runId)
                .entities(List.copyOf(entityMetrics))
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .durationMs(elapsedMs(startNanos));
        if (failure == null) {
            return result.state(BatchState.COMPLETED).build();
        }
        return result.state(BatchState.FAILED)
                .failedEntity(failedEntity)
                .failureMessage(failure.getMessage())
                .failureCategory(ErrorCategory.categorize(failure))
                .build();
    }

    private void logSummary(BatchRunMetrics run) {
        log.info("[BATCH] {}", String.format("%-18s | %-9s | %8s | %8s | %8s | %8s",
                "Table", "Status", "Bronze", "Silver", "Rejected", "Duration"));
        for (EntityRunMetrics m : run.getEntities()) {
            log.info("[BATCH] {}", String.format("%-18s | %-9s | %8d | %8d | %8d | %6dms  %s",
                    m.getEntity().getTableName(), m.getStatus(), m.getSourceRows(), m.getAcceptedRows(),
                    m.getRejectedRows(), m.getDurationMs(), m.getStatus() == EntityStatus.SUCCEEDED ? m.qualityFlag() : ""));
        }
        if (run.getState() == BatchState.COMPLETED) {
            log.info("[BATCH] runId={} COMPLETED in {}ms: {} rows accepted, {} rows quarantined",
                    run.getRunId(), run.getDurationMs(), run.getTotalAcceptedRows(), run.getTotalRejectedRows());
        } else {
            log.error("[BATCH] runId={} FAILED in {}ms at entity={} [{}]: {}",
                    run.getRunId(), run.getDurationMs(), run.getFailedEntity(),
                    run.getFailureCategory().getName(), run.getFailureMessage());
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
