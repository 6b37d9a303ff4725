package com.di.qualitygate.store;

import com.di.qualitygate.model.QuarantineRecord;

import java.util.List;

/**
 * Append-only store of rejected rows. Cleared at the start of every batch run.
 */
public interface QuarantineSink {

    void clear();

    void append(List<QuarantineRecord> records);

    /** Rejected row counts grouped by source table and reason. */
    List<QuarantineSummaryRow> summarize();
}
