package com.di.qualitygate.rules;

import com.di.qualitygate.model.ErpCategoryRecord;
import com.di.qualitygate.model.SourceEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.di.qualitygate.support.QualityGateFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErpCategoryRules Tests")
class ErpCategoryRulesTest {

    private final ErpCategoryRules rules = new ErpCategoryRules();

    @Test
    @DisplayName("Should trim every column")
    void testNormalize_Trim() {
        ErpCategoryRecord record = rules.normalize(raw(SourceEntity.ERP_CATEGORY, 1,
                "id", " BI_MB ", "cat", "Bikes ", "subcat", " Mountain Bikes", "maintenance", "Yes")).getRecord();

        assertEquals("BI_MB", record.getId());
        assertEquals("Bikes", record.getCat());
        assertEquals("Mountain Bikes", record.getSubcat());
        assertEquals("Yes", record.getMaintenance());
    }

    @Test
    @DisplayName("Should reject a missing id and use strict deduplication")
    void testNormalize_MissingId() {
        assertFalse(rules.normalize(raw(SourceEntity.ERP_CATEGORY, 1, "id", null)).isAccepted());
        assertEquals("RejectAllOnConflict(id)", rules.deduplicationPolicy().name());
    }
}
