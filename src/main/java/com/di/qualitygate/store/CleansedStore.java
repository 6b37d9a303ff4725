package com.di.qualitygate.store;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.SourceEntity;

import java.util.List;

/**
 * Target of the wholesale replace: after {@link #replace} the entity's cleansed
 * table holds exactly the given records.
 */
public interface CleansedStore {

    void replace(SourceEntity entity, List<? extends CleanRecord> records);

    long count(SourceEntity entity);
}
