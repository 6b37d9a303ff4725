package com.di.qualitygate.dedup;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.Rejection;
import com.di.qualitygate.model.RejectionReason;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Strict deduplication: a key that occurs more than once is treated as
 * unresolvable and every row carrying it is quarantined as
 * {@link RejectionReason#DUPLICATE_ID}. No copy survives.
 */
public final class RejectAllOnConflict<T extends CleanRecord> implements DeduplicationPolicy<T> {

    private final String keyField;
    private final Function<T, String> groupKey;

    public RejectAllOnConflict(String keyField, Function<T, String> groupKey) {
        this.keyField = keyField;
        this.groupKey = groupKey;
    }

    @Override
    public DeduplicationResult<T> resolve(List<Candidate<T>> candidates) {
        List<Candidate<T>> accepted = new ArrayList<>();
        List<Candidate<T>> conflicting = new ArrayList<>();

        for (List<Candidate<T>> group : DeduplicationPolicy.groupBy(candidates, groupKey).values()) {
            if (group.size() == 1) {
                accepted.add(group.get(0));
            } else {
                conflicting.addAll(group);
            }
        }

        accepted.sort(DeduplicationPolicy.byOrdinal());
        conflicting.sort(DeduplicationPolicy.byOrdinal());

        List<Rejection> rejected = new ArrayList<>(conflicting.size());
        for (Candidate<T> candidate : conflicting) {
            rejected.add(new Rejection(candidate.raw(), keyField, RejectionReason.DUPLICATE_ID));
        }
        return new DeduplicationResult<>(accepted, rejected);
    }

    @Override
    public String name() {
        return "RejectAllOnConflict(" + keyField + ")";
    }
}
