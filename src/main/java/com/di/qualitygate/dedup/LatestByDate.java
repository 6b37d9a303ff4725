package com.di.qualitygate.dedup;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.Rejection;
import com.di.qualitygate.model.RejectionReason;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Latest-wins deduplication: within each group sharing a key, candidates are
 * ranked descending by the order key and only rank 1 survives. Every other rank
 * is quarantined individually as {@link RejectionReason#DUPLICATE_RECORD}.
 *
 * <p>A null order key ranks below any dated row. Equal order keys fall back to
 * staging order (the earlier row wins) so repeated runs pick the same survivor.
 */
public final class LatestByDate<T extends CleanRecord, C extends Comparable<? super C>>
        implements DeduplicationPolicy<T> {

    private final String keyField;
    private final Function<T, String> groupKey;
    private final Comparator<Candidate<T>> ranking;

    public LatestByDate(String keyField, Function<T, String> groupKey, Function<T, C> orderKey) {
        this.keyField = keyField;
        this.groupKey = groupKey;
        Comparator<Candidate<T>> byOrderKeyDesc = Comparator.comparing(
                c -> orderKey.apply(c.record()),
                Comparator.nullsLast(Comparator.<C>reverseOrder()));
        this.ranking = byOrderKeyDesc.thenComparing(DeduplicationPolicy.byOrdinal());
    }

    @Override
    public DeduplicationResult<T> resolve(List<Candidate<T>> candidates) {
        List<Candidate<T>> accepted = new ArrayList<>();
        List<Candidate<T>> losers = new ArrayList<>();

        for (Map.Entry<String, List<Candidate<T>>> group : DeduplicationPolicy.groupBy(candidates, groupKey).entrySet()) {
            List<Candidate<T>> ranked = new ArrayList<>(group.getValue());
            ranked.sort(ranking);
            accepted.add(ranked.get(0));
            losers.addAll(ranked.subList(1, ranked.size()));
        }

        accepted.sort(DeduplicationPolicy.byOrdinal());
        losers.sort(DeduplicationPolicy.byOrdinal());

        List<Rejection> rejected = new ArrayList<>(losers.size());
        for (Candidate<T> loser : losers) {
            rejected.add(new Rejection(loser.raw(), keyField, RejectionReason.DUPLICATE_RECORD));
        }
        return new DeduplicationResult<>(accepted, rejected);
    }

    @Override
    public String name() {
        return "LatestByDate(" + keyField + ")";
    }
}
