package com.di.qualitygate.dedup;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.RawRecord;

/**
 * A normalized record together with the raw row it was derived from.
 */
public record Candidate<T extends CleanRecord>(RawRecord raw, T record) {

    public long ordinal() {
        return raw.getOrdinal();
    }
}
