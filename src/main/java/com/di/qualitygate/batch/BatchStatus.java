package com.di.qualitygate.batch;

import com.di.qualitygate.model.SourceEntity;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of the orchestrator. {@code runId} and {@code currentEntity}
 * are set only while a run is in progress.
 */
@Value
@Builder
public class BatchStatus {

    BatchState state;
    String runId;
    SourceEntity currentEntity;
}
