package com.di.qualitygate.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cleansed row of {@code silver.erp_px_cat_g1v2}.
 */
@Value
@Builder
public class ErpCategoryRecord implements CleanRecord {

    String id;
    String cat;
    String subcat;
    String maintenance;
    @With
    Instant dwhInsertionDate;

    @Override
    public String businessKey() {
        return id;
    }

    @Override
    public ErpCategoryRecord stampedAt(Instant insertedAt) {
        return withDwhInsertionDate(insertedAt);
    }

    @Override
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("id", id);
        columns.put("cat", cat);
        columns.put("subcat", subcat);
        columns.put("maintenance", maintenance);
        columns.put("dwh_insertion_date", dwhInsertionDate);
        return columns;
    }
}
