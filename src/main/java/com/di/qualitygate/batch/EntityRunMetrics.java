package com.di.qualitygate.batch;

import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SourceEntity;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of one entity within a batch run.
 */
@Value
@Builder
public class EntityRunMetrics {

    SourceEntity entity;
    EntityStatus status;
    long sourceRows;
    long acceptedRows;
    long rejectedRows;
    @Builder.Default
    Map<RejectionReason, Long> rejectedByReason = Map.of();
    long durationMs;
    /** Set when {@link #status} is FAILED. */
    String failureMessage;

    /** OK when nothing was rejected, KO otherwise. */
    @JsonProperty("qualityFlag")
    public String qualityFlag() {
        return rejectedRows == 0 ? "OK" : "KO";
    }

    public static EntityRunMetrics skipped(SourceEntity entity) {
        return EntityRunMetrics.builder().entity(entity).status(EntityStatus.SKIPPED).build();
    }
}
