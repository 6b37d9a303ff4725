package com.di.qualitygate.batch;

/** IDLE → RUNNING → COMPLETED | FAILED. */
public enum BatchState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
