package com.di.qualitygate.util;

import com.di.qualitygate.batch.BatchState;
import com.di.qualitygate.batch.EntityStatus;
import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SourceEntity;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for quality gate runs.
 *
 * <ul>
 *   <li>{@code qualitygate.entity.rows} (entity, outcome=source|accepted|rejected)</li>
 *   <li>{@code qualitygate.entity.rejected} (entity, reason)</li>
 *   <li>{@code qualitygate.entity.duration} (entity, status)</li>
 *   <li>{@code qualitygate.batch.runs} (state)</li>
 *   <li>{@code qualitygate.batch.duration}</li>
 * </ul>
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;
    private final Timer batchTimer;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.batchTimer = Timer.builder("qualitygate.batch.duration")
                .description("Time taken by a full quality gate batch")
                .register(meterRegistry);
    }

    // ============================================================================
    // Entity Metrics
    // ============================================================================

    public void recordEntityRows(SourceEntity entity, long source, long accepted, Map<RejectionReason, Long> rejectedByReason) {
        String tag = entity.getTableName();
        meterRegistry.counter("qualitygate.entity.rows", "entity", tag, "outcome", "source").increment(source);
        meterRegistry.counter("qualitygate.entity.rows", "entity", tag, "outcome", "accepted").increment(accepted);
        long rejected = 0;
        for (Map.Entry<RejectionReason, Long> e : rejectedByReason.entrySet()) {
            meterRegistry.counter("qualitygate.entity.rejected", "entity", tag, "reason", e.getKey().name())
                    .increment(e.getValue());
            rejected += e.getValue();
        }
        meterRegistry.counter("qualitygate.entity.rows", "entity", tag, "outcome", "rejected").increment(rejected);
        log.debug("Recorded entity rows: entity={}, source={}, accepted={}, rejected={}", tag, source, accepted, rejected);
    }

    public void recordEntityDuration(SourceEntity entity, EntityStatus status, long durationMs) {
        Timer.builder("qualitygate.entity.duration")
                .description("Time taken to cleanse and publish one entity")
                .tag("entity", entity.getTableName())
                .tag("status", status.name())
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    // ============================================================================
    // Batch Metrics
    // ============================================================================

    public void recordBatch(BatchState finalState, long durationMs) {
        meterRegistry.counter("qualitygate.batch.runs", "state", finalState.name()).increment();
        batchTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded batch: state={}, durationMs={}", finalState, durationMs);
    }

    public void recordRefusedBatch() {
        meterRegistry.counter("qualitygate.batch.refused").increment();
    }
}
