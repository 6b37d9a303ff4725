package com.di.qualitygate.model;

import java.util.Locale;

/**
 * The six staging entities handled by the quality gate, declared in the fixed
 * order in which a batch processes them.
 *
 * <pre>
 *   CUSTOMER          bronze.crm_cust_info      → silver.crm_cust_info
 *   PRODUCT           bronze.crm_prd_info       → silver.crm_prd_info
 *   SALES_LINE        bronze.crm_sales_details  → silver.crm_sales_details
 *   ERP_CUSTOMER_DEMO bronze.erp_cust_az12      → silver.erp_cust_az12
 *   ERP_LOCATION      bronze.erp_loc_a101       → silver.erp_loc_a101
 *   ERP_CATEGORY      bronze.erp_px_cat_g1v2    → silver.erp_px_cat_g1v2
 * </pre>
 */
public enum SourceEntity {

    CUSTOMER("crm_cust_info", "cst_id"),
    PRODUCT("crm_prd_info", "prd_id"),
    SALES_LINE("crm_sales_details", "sls_ord_num"),
    ERP_CUSTOMER_DEMO("erp_cust_az12", "cid"),
    ERP_LOCATION("erp_loc_a101", "cid"),
    ERP_CATEGORY("erp_px_cat_g1v2", "id");

    private static final String STAGING_SCHEMA = "bronze";
    private static final String CLEANSED_SCHEMA = "silver";

    private final String tableName;
    private final String keyColumn;

    SourceEntity(String tableName, String keyColumn) {
        this.tableName = tableName;
        this.keyColumn = keyColumn;
    }

    /** Unqualified table name shared by the staging and cleansed schemas. */
    public String getTableName() {
        return tableName;
    }

    /** Column holding the business key in the staging table. */
    public String getKeyColumn() {
        return keyColumn;
    }

    public String stagingTable() {
        return STAGING_SCHEMA + "." + tableName;
    }

    public String cleansedTable() {
        return CLEANSED_SCHEMA + "." + tableName;
    }

    /** Key used for per-entity SQL lookups in {@code sql-queries.yml} (e.g. {@code sales-line}). */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
