package com.di.qualitygate.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SourceEntity Tests")
class SourceEntityTest {

    @Test
    @DisplayName("Should process entities in the fixed batch order")
    void testOrder() {
        assertEquals(List.of(SourceEntity.CUSTOMER, SourceEntity.PRODUCT, SourceEntity.SALES_LINE,
                        SourceEntity.ERP_CUSTOMER_DEMO, SourceEntity.ERP_LOCATION, SourceEntity.ERP_CATEGORY),
                List.of(SourceEntity.values()));
    }

    @Test
    @DisplayName("Should derive staging and cleansed table names")
    void testTables() {
        assertEquals("bronze.crm_sales_details", SourceEntity.SALES_LINE.stagingTable());
        assertEquals("silver.crm_sales_details", SourceEntity.SALES_LINE.cleansedTable());
        assertEquals("sls_ord_num", SourceEntity.SALES_LINE.getKeyColumn());
    }

    @Test
    @DisplayName("Should derive the configuration key")
    void testConfigKey() {
        assertEquals("erp-customer-demo", SourceEntity.ERP_CUSTOMER_DEMO.configKey());
        assertEquals("customer", SourceEntity.CUSTOMER.configKey());
    }
}
