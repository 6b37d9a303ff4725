package com.di.qualitygate.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cleansed row of {@code silver.crm_cust_info}.
 */
@Value
@Builder
public class CustomerRecord implements CleanRecord {

    int cstId;
    String cstKey;
    String cstFirstname;
    String cstLastname;
    String cstMaritalStatus;
    String cstGender;
    LocalDate cstCreateDate;
    @With
    Instant dwhInsertionDate;

    @Override
    public String businessKey() {
        return Integer.toString(cstId);
    }

    @Override
    public CustomerRecord stampedAt(Instant insertedAt) {
        return withDwhInsertionDate(insertedAt);
    }

    @Override
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("cst_id", cstId);
        columns.put("cst_key", cstKey);
        columns.put("cst_firstname", cstFirstname);
        columns.put("cst_lastname", cstLastname);
        columns.put("cst_marital_status", cstMaritalStatus);
        columns.put("cst_gender", cstGender);
        columns.put("cst_create_date", cstCreateDate);
        columns.put("dwh_insertion_date", dwhInsertionDate);
        return columns;
    }
}
