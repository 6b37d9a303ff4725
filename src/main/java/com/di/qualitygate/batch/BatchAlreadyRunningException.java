package com.di.qualitygate.batch;

/** Thrown when a batch is requested while another one is still running. */
public class BatchAlreadyRunningException extends RuntimeException {

    private final String runningRunId;

    public BatchAlreadyRunningException(String runningRunId) {
        super("A quality gate batch is already running (runId=" + runningRunId + ")");
        this.runningRunId = runningRunId;
    }

    public String getRunningRunId() {
        return runningRunId;
    }
}
