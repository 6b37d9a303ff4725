package com.di.qualitygate.dedup;

import com.di.qualitygate.model.CleanRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Conflict policy applied to candidates that share a business key.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link LatestByDate} keeps the most recent row per key and quarantines the rest.</li>
 *   <li>{@link RejectAllOnConflict} quarantines every row of an ambiguous key.</li>
 *   <li>{@link KeepAll} performs no deduplication.</li>
 * </ul>
 */
public interface DeduplicationPolicy<T extends CleanRecord> {

    DeduplicationResult<T> resolve(List<Candidate<T>> candidates);

    /** Short name used in logs. */
    String name();

    /** Groups candidates by key, preserving first-appearance order of the keys. */
    static <T extends CleanRecord> Map<String, List<Candidate<T>>> groupBy(
            List<Candidate<T>> candidates, Function<T, String> groupKey) {
        Map<String, List<Candidate<T>>> groups = new LinkedHashMap<>();
        for (Candidate<T> candidate : candidates) {
            groups.computeIfAbsent(groupKey.apply(candidate.record()), k -> new ArrayList<>()).add(candidate);
        }
        return groups;
    }

    /** Orders by staging position. */
    static <T extends CleanRecord> Comparator<Candidate<T>> byOrdinal() {
        return Comparator.comparingLong(Candidate::ordinal);
    }
}
