package com.di.qualitygate.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cleansed row of {@code silver.crm_prd_info}.
 *
 * <p>{@code sourceKey} is the full trimmed staging key (e.g. {@code CO-RF-FR-R92B-58});
 * it partitions the validity timeline and is not persisted.
 */
@Value
@Builder(toBuilder = true)
public class ProductRecord implements CleanRecord {

    int prdId;
    String prdKey;
    String catId;
    String prdNm;
    BigDecimal prdCost;
    String prdLine;
    LocalDate prdStartDt;
    @With
    LocalDate prdEndDt;
    String sourceKey;
    @With
    Instant dwhInsertionDate;

    @Override
    public String businessKey() {
        return Integer.toString(prdId);
    }

    @Override
    public ProductRecord stampedAt(Instant insertedAt) {
        return withDwhInsertionDate(insertedAt);
    }

    @Override
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("prd_id", prdId);
        columns.put("prd_key", prdKey);
        columns.put("cat_id", catId);
        columns.put("prd_nm", prdNm);
        columns.put("prd_cost", prdCost);
        columns.put("prd_line", prdLine);
        columns.put("prd_start_dt", prdStartDt);
        columns.put("prd_end_dt", prdEndDt);
        columns.put("dwh_insertion_date", dwhInsertionDate);
        return columns;
    }
}
