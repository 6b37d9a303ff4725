package com.di.qualitygate.batch;

import com.di.qualitygate.exception.ErrorCategory;
import com.di.qualitygate.model.SourceEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Result of a batch run: final state, one {@link EntityRunMetrics} per entity in
 * run order, and the failing entity when the run failed.
 */
@Value
@Builder
public class BatchRunMetrics {

    String runId;
    BatchState state;
    List<EntityRunMetrics> entities;
    SourceEntity failedEntity;
    String failureMessage;
    ErrorCategory failureCategory;
    Instant startedAt;
    Instant finishedAt;
    long durationMs;

    public Optional<EntityRunMetrics> entity(SourceEntity entity) {
        return entities.stream().filter(m -> m.getEntity() == entity).findFirst();
    }

    public long getTotalAcceptedRows() {
        return entities.stream().mapToLong(EntityRunMetrics::getAcceptedRows).sum();
    }

    public long getTotalRejectedRows() {
        return entities.stream().mapToLong(EntityRunMetrics::getRejectedRows).sum();
    }
}
