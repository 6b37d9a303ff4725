package com.di.qualitygate.batch;

public enum EntityStatus {
    SUCCEEDED,
    FAILED,
    /** Not run because an earlier entity of the same batch failed. */
    SKIPPED
}
