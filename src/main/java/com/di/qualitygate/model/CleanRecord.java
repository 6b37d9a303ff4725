package com.di.qualitygate.model;

import java.time.Instant;
import java.util.Map;

/**
 * A typed, normalized row accepted into the cleansed store.
 */
public interface CleanRecord {

    /** Natural identifier used for deduplication and cross-entity matching. */
    String businessKey();

    /** Lineage timestamp, null until the record is written. */
    Instant getDwhInsertionDate();

    /** Copy of this record carrying the given lineage timestamp. */
    CleanRecord stampedAt(Instant insertedAt);

    /**
     * Column name to value, in cleansed-table column order, including
     * {@code dwh_insertion_date}.
     */
    Map<String, Object> toColumns();
}
