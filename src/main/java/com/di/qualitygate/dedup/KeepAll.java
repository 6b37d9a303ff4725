package com.di.qualitygate.dedup;

import com.di.qualitygate.model.CleanRecord;

import java.util.List;

/** No deduplication; every candidate is accepted. */
public final class KeepAll<T extends CleanRecord> implements DeduplicationPolicy<T> {

    @Override
    public DeduplicationResult<T> resolve(List<Candidate<T>> candidates) {
        return new DeduplicationResult<>(candidates, List.of());
    }

    @Override
    public String name() {
        return "KeepAll";
    }
}
