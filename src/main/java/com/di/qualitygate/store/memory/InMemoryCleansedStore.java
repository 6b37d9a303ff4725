package com.di.qualitygate.store.memory;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.store.CleansedStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConditionalOnProperty(name = "qualitygate.store.type", havingValue = "memory")
public class InMemoryCleansedStore implements CleansedStore {

    private final Map<SourceEntity, List<CleanRecord>> tables = new EnumMap<>(SourceEntity.class);

    @Override
    public synchronized void replace(SourceEntity entity, List<? extends CleanRecord> records) {
        tables.put(entity, List.copyOf(records));
    }

    @Override
    public synchronized long count(SourceEntity entity) {
        return findAll(entity).size();
    }

    public synchronized List<CleanRecord> findAll(SourceEntity entity) {
        return tables.getOrDefault(entity, List.of());
    }
}
