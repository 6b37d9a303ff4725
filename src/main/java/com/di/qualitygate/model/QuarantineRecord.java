package com.di.qualitygate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Domain model for the {@code silver.quality_quarantine} table.
 *
 * <p>{@code rawData} is the verbatim staging row keyed by column name; it is
 * stored as JSONB so any staging schema can be captured without a per-entity
 * quarantine table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuarantineRecord {

    /** Staging table the row came from, e.g. {@code bronze.crm_cust_info}. */
    private String sourceTable;

    private String rejectedColumn;
    private String rejectedReason;
    private Map<String, String> rawData;

    /** Capture timestamp. */
    private Instant dwhInsertionDate;
}
