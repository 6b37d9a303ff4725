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
 * Cleansed row of {@code silver.crm_sales_details}. Sales lines are not
 * deduplicated; the business key only identifies the line in logs.
 */
@Value
@Builder
public class SalesLineRecord implements CleanRecord {

    String slsOrdNum;
    String slsPrdKey;
    int slsCusId;
    LocalDate slsOrdDt;
    LocalDate slsShipDt;
    LocalDate slsDueDt;
    BigDecimal slsSales;
    Integer slsQuantity;
    BigDecimal slsPrice;
    @With
    Instant dwhInsertionDate;

    @Override
    public String businessKey() {
        return slsOrdNum + "/" + slsPrdKey;
    }

    @Override
    public SalesLineRecord stampedAt(Instant insertedAt) {
        return withDwhInsertionDate(insertedAt);
    }

    @Override
    public Map<String, Object> toColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("sls_ord_num", slsOrdNum);
        columns.put("sls_prd_key", slsPrdKey);
        columns.put("sls_cus_id", slsCusId);
        columns.put("sls_ord_dt", slsOrdDt);
        columns.put("sls_ship_dt", slsShipDt);
        columns.put("sls_due_dt", slsDueDt);
        columns.put("sls_sales", slsSales);
        columns.put("sls_quantity", slsQuantity);
        columns.put("sls_price", slsPrice);
        columns.put("dwh_insertion_date", dwhInsertionDate);
        return columns;
    }
}
