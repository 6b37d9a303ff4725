package com.di.qualitygate.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cleansed row of {@code silver.erp_loc_a101}.
 */
@Value
@Builder
public class ErpLocationRecord implements CleanRecord {

    String cid;
    String cntry;
    @With
    Instant dwhInsertionDate;

    @Override
    public String businessKey() {
        return cid;
    }

    @Override
    public ErpLocationRecord stampedAt(Instant insertedAt) {
        return withDwhInsertionDate(insertedAt);
    }

    @Override
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("cid", cid);
        columns.put("cntry", cntry);
        columns.put("dwh_insertion_date", dwhInsertionDate);
        return columns;
    }
}
