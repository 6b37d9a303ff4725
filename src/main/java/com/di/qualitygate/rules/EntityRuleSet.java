package com.di.qualitygate.rules;

import com.di.qualitygate.dedup.DeduplicationPolicy;
import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;

import java.util.List;

/**
 * Cleansing rules for one staging entity.
 *
 * <p>{@link #normalize(RawRecord)} is a pure function of one raw row. It never
 * throws for malformed but representable values (those are mapped or
 * rejected); it throws {@link UnparsableValueException} only when a value
 * cannot be read as its declared type at all.
 *
 * @param <T> cleansed record type
 */
public interface EntityRuleSet<T extends CleanRecord> {

    SourceEntity entity();

    RuleOutcome<T> normalize(RawRecord raw);

    DeduplicationPolicy<T> deduplicationPolicy();

    /**
     * Set-level derivations computed over the accepted records after
     * deduplication. Must not add or drop records.
     */
    default List<T> postProcess(List<T> accepted) {
        return accepted;
    }
}
