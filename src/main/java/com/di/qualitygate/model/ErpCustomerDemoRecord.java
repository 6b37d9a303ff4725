package com.di.qualitygate.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cleansed row of {@code silver.erp_cust_az12} (customer demographics).
 */
@Value
@Builder
public class ErpCustomerDemoRecord implements CleanRecord {

    String cid;
    LocalDate bdate;
    String gen;
    @With
    Instant dwhInsertionDate;

    @Override
    public String businessKey() {
        return cid;
    }

    @Override
    public ErpCustomerDemoRecord stampedAt(Instant insertedAt) {
        return withDwhInsertionDate(insertedAt);
    }

    @Override
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("cid", cid);
        columns.put("bdate", bdate);
        columns.put("gen", gen);
        columns.put("dwh_insertion_date", dwhInsertionDate);
        return columns;
    }
}
