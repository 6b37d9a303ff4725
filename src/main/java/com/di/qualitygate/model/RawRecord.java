package com.di.qualitygate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One untyped staging row. Values are kept verbatim (untrimmed, possibly null)
 * so that a rejected row can be quarantined exactly as it arrived.
 *
 * <p>{@code ordinal} is the row's position in the staging read and is the
 * deterministic tie-breaker wherever two rows compare equal.
 */
public final class RawRecord {

    private final SourceEntity entity;
    private final long ordinal;
    private final Map<String, String> fields;

    public RawRecord(SourceEntity entity, long ordinal, Map<String, String> fields) {
        this.entity = Objects.requireNonNull(entity, "entity");
        this.ordinal = ordinal;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public SourceEntity getEntity() {
        return entity;
    }

    public long getOrdinal() {
        return ordinal;
    }

    /** Verbatim payload in staging column order. */
    public Map<String, String> getFields() {
        return fields;
    }

    /** Verbatim value, or null when the column is absent. */
    public String raw(String column) {
        return fields.get(column);
    }

    /**
     * Trimmed value; blank and missing values are both reported as null.
     */
    public String text(String column) {
        String value = fields.get(column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawRecord)) return false;
        RawRecord that = (RawRecord) o;
        return ordinal == that.ordinal && entity == that.entity && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, ordinal, fields);
    }

    @Override
    public String toString() {
        return "RawRecord{" + entity.stagingTable() + "#" + ordinal + " " + fields + "}";
    }
}
