package com.di.qualitygate.model;

import java.time.Instant;

/**
 * A raw row refused by a rule or a deduplication policy, before it is stamped
 * and written to the quarantine.
 */
public record Rejection(RawRecord raw, String field, RejectionReason reason) {

    public QuarantineRecord toQuarantine(Instant capturedAt) {
        return QuarantineRecord.builder()
                .sourceTable(raw.getEntity().stagingTable())
                .rejectedColumn(field)
                .rejectedReason(reason.getLabel())
                .rawData(raw.getFields())
                .dwhInsertionDate(capturedAt)
                .build();
    }
}
