package com.di.qualitygate.gate;

import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SourceEntity;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Counts of one successful pass of the gate over an entity.
 * {@code acceptedCount + rejectedCount() == sourceCount} always holds.
 */
@Value
@Builder
public class GateResult {

    SourceEntity entity;
    long sourceCount;
    long acceptedCount;
    Map<RejectionReason, Long> rejectedByReason;
    String deduplicationPolicy;

    public long rejectedCount() {
        return rejectedByReason.values().stream().mapToLong(Long::longValue).sum();
    }
}
