package com.di.qualitygate.dedup;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.Rejection;

import java.util.List;

/**
 * Accept / reject split produced by a {@link DeduplicationPolicy}. Accepted
 * candidates keep staging order.
 */
public record DeduplicationResult<T extends CleanRecord>(List<Candidate<T>> accepted, List<Rejection> rejected) {

    public DeduplicationResult {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }
}
