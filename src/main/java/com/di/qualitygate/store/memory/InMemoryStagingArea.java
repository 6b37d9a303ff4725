package com.di.qualitygate.store.memory;

import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.store.StagingReader;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Heap-backed staging area. Rows are loaded by the caller (tests, demos) and
 * read back in load order.
 */
@Component
@ConditionalOnProperty(name = "qualitygate.store.type", havingValue = "memory")
public class InMemoryStagingArea implements StagingReader {

    private final Map<SourceEntity, List<Map<String, String>>> rows = new EnumMap<>(SourceEntity.class);

    /** Replaces the staging rows of an entity. */
    public synchronized void load(SourceEntity entity, List<Map<String, String>> entityRows) {
        List<Map<String, String>> copy = new ArrayList<>(entityRows.size());
        for (Map<String, String> row : entityRows) {
            copy.add(new LinkedHashMap<>(row));
        }
        rows.put(entity, copy);
    }

    @Override
    public synchronized List<RawRecord> readAll(SourceEntity entity) {
        List<Map<String, String>> entityRows = rows.getOrDefault(entity, List.of());
        List<RawRecord> records = new ArrayList<>(entityRows.size());
        for (Map<String, String> row : entityRows) {
            records.add(new RawRecord(entity, records.size() + 1L, row));
        }
        return records;
    }
}
