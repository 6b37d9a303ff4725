package com.di.qualitygate.store.memory;

import com.di.qualitygate.model.QuarantineRecord;
import com.di.qualitygate.store.QuarantineSink;
import com.di.qualitygate.store.QuarantineSummaryRow;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * In-memory implementation of {@link QuarantineSink}. Used when
 * {@code qualitygate.store.type=memory} and by the engine tests.
 */
@Component
@ConditionalOnProperty(name = "qualitygate.store.type", havingValue = "memory")
public class InMemoryQuarantineSink implements QuarantineSink {

    private final List<QuarantineRecord> records = new ArrayList<>();

    @Override
    public synchronized void clear() {
        records.clear();
    }

    @Override
    public synchronized void append(List<QuarantineRecord> newRecords) {
        if (newRecords == null) return;
        records.addAll(newRecords);
    }

    /** Same grouping and ordering as the JDBC summary query. */
    @Override
    public synchronized List<QuarantineSummaryRow> summarize() {
        Map<List<String>, Long> counts = new TreeMap<>(
                Comparator.<List<String>, String>comparing(k -> k.get(0)).thenComparing(k -> k.get(1)));
        for (QuarantineRecord r : records) {
            counts.merge(List.of(r.getSourceTable(), r.getRejectedReason()), 1L, Long::sum);
        }
        List<QuarantineSummaryRow> summary = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> summary.add(new QuarantineSummaryRow(key.get(0), key.get(1), count)));
        return summary;
    }

    public synchronized List<QuarantineRecord> findAll() {
        return List.copyOf(records);
    }
}
