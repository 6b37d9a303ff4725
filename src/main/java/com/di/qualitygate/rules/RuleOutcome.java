package com.di.qualitygate.rules;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.RejectionReason;

/**
 * Result of normalizing one raw row: either a typed candidate or a rejection
 * naming the offending field.
 */
public final class RuleOutcome<T extends CleanRecord> {

    private final T record;
    private final String rejectedField;
    private final RejectionReason reason;

    private RuleOutcome(T record, String rejectedField, RejectionReason reason) {
        this.record = record;
        this.rejectedField = rejectedField;
        this.reason = reason;
    }

    public static <T extends CleanRecord> RuleOutcome<T> accepted(T record) {
        return new RuleOutcome<>(record, null, null);
    }

    public static <T extends CleanRecord> RuleOutcome<T> rejected(String field, RejectionReason reason) {
        return new RuleOutcome<>(null, field, reason);
    }

    public static <T extends CleanRecord> RuleOutcome<T> missingKey(String field) {
        return rejected(field, RejectionReason.MISSING_MANDATORY_KEY);
    }

    public boolean isAccepted() {
        return record != null;
    }

    public T getRecord() {
        return record;
    }

    public String getRejectedField() {
        return rejectedField;
    }

    public RejectionReason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isAccepted() ? "accepted " + record : "rejected " + rejectedField + ": " + reason;
    }
}
