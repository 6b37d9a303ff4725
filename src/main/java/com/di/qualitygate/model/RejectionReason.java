package com.di.qualitygate.model;

/**
 * Reasons recorded in {@code silver.quality_quarantine.rejected_reason}.
 * The labels are part of the quarantine contract consumed by data stewards.
 */
public enum RejectionReason {

    MISSING_MANDATORY_KEY("Missing Mandatory Key"),
    DUPLICATE_RECORD("Duplicate Record"),
    DUPLICATE_ID("Duplicate ID — Manual Investigation Required"),
    UNPARSABLE_VALUE("Unparsable Value"),
    INVALID_DATE_CHRONOLOGY("Invalid Date Chronology"),
    NEGATIVE_AMOUNT("Negative Monetary Amount");

    private final String label;

    RejectionReason(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
