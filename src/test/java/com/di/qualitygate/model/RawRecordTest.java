package com.di.qualitygate.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RawRecord Tests")
class RawRecordTest {

    private static RawRecord record() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("cst_id", " 11000 ");
        fields.put("cst_firstname", "   ");
        fields.put("cst_lastname", null);
        return new RawRecord(SourceEntity.CUSTOMER, 7, fields);
    }

    @Test
    @DisplayName("Should trim text and report blank or missing values as null")
    void testText() {
        RawRecord raw = record();
        assertEquals("11000", raw.text("cst_id"));
        assertNull(raw.text("cst_firstname"));
        assertNull(raw.text("cst_lastname"));
        assertNull(raw.text("no_such_column"));
    }

    @Test
    @DisplayName("Should keep raw values verbatim")
    void testRaw() {
        RawRecord raw = record();
        assertEquals(" 11000 ", raw.raw("cst_id"));
        assertEquals("   ", raw.raw("cst_firstname"));
        assertThrows(UnsupportedOperationException.class, () -> raw.getFields().put("x", "y"));
    }

    @Test
    @DisplayName("Should quarantine the verbatim payload with the rejection reason label")
    void testRejectionToQuarantine() {
        Instant now = Instant.parse("2024-06-15T10:00:00Z");
        Rejection rejection = new Rejection(record(), "cst_id", RejectionReason.DUPLICATE_RECORD);

        QuarantineRecord quarantined = rejection.toQuarantine(now);

        assertEquals("bronze.crm_cust_info", quarantined.getSourceTable());
        assertEquals("cst_id", quarantined.getRejectedColumn());
        assertEquals("Duplicate Record", quarantined.getRejectedReason());
        assertEquals(" 11000 ", quarantined.getRawData().get("cst_id"));
        assertTrue(quarantined.getRawData().containsKey("cst_lastname"));
        assertEquals(now, quarantined.getDwhInsertionDate());
    }
}
