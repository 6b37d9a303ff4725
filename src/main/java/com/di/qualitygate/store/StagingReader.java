package com.di.qualitygate.store;

import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;

import java.util.List;

/**
 * Reads the full staging content of an entity. Ordinals start at 1 and follow
 * the read order.
 *
 * <p>The read order must be the same on every read of unchanged staging data:
 * the ordinal breaks deduplication ties and orders the quarantine, so an
 * unstable order would let two runs pick different survivors.
 */
public interface StagingReader {

    List<RawRecord> readAll(SourceEntity entity);
}
