package com.di.qualitygate.rules;

import com.di.qualitygate.model.ProductRecord;
import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SourceEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.di.qualitygate.support.QualityGateFixtures.raw;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProductRules Tests")
class ProductRulesTest {

    private final ProductRules rules = new ProductRules();

    // ============================================================================
    // normalize Tests
    // ============================================================================

    @Test
    @DisplayName("Should split the staging key into category and product keys")
    void testNormalize_KeySplit() {
        ProductRecord record = rules.normalize(raw(SourceEntity.PRODUCT, 1,
                "prd_id", "210", "prd_key", "CO-RF-FR-R92B-58", "prd_nm", "HL Road Frame - Black- 58",
                "prd_cost", "", "prd_line", "R ", "prd_start_dt", "2003-07-01", "prd_end_dt", "2004-01-01"))
                .getRecord();

        assertEquals(210, record.getPrdId());
        assertEquals("CO_RF", record.getCatId());
        assertEquals("FR-R92B-58", record.getPrdKey());
        assertEquals("CO-RF-FR-R92B-58", record.getSourceKey());
        assertEquals(new BigDecimal("0.00"), record.getPrdCost());
        assertEquals("Road", record.getPrdLine());
        assertEquals(LocalDate.of(2003, 7, 1), record.getPrdStartDt());
        assertNull(record.getPrdEndDt(), "source end date is discarded");
    }

    @ParameterizedTest
    @CsvSource({
        "CO-RF-FR-R92B-58, CO_RF, FR-R92B-58",
        "AC-HE, AC_HE, ''",
        "AC-HE-X, AC_HE, X",
        "BK, BK, ''"
    })
    @DisplayName("Should derive category and short keys")
    void testKeyDerivation(String key, String expectedCategory, String expectedShortKey) {
        assertEquals(expectedCategory, ProductRules.categoryKey(key));
        assertEquals(expectedShortKey, ProductRules.shortKey(key));
    }

    @ParameterizedTest
    @CsvSource(value = {"M, Mountain", "r, Road", "S, Other sales", "T, Touring", "X, n/a", "NULL, n/a"}, nullValues = "NULL")
    @DisplayName("Should map product line codes")
    void testProductLine(String code, String expected) {
        assertEquals(expected, ProductRules.productLine(code));
    }

    @Test
    @DisplayName("Should reject a negative cost")
    void testNormalize_NegativeCost() {
        RuleOutcome<ProductRecord> outcome = rules.normalize(raw(SourceEntity.PRODUCT, 1,
                "prd_id", "213", "prd_key", "AC-HE-HL-U509-R", "prd_cost", "-5"));

        assertFalse(outcome.isAccepted());
        assertEquals("prd_cost", outcome.getRejectedField());
        assertEquals(RejectionReason.NEGATIVE_AMOUNT, outcome.getReason());
    }

    @Test
    @DisplayName("Should reject a missing product key")
    void testNormalize_MissingKey() {
        RuleOutcome<ProductRecord> outcome = rules.normalize(raw(SourceEntity.PRODUCT, 1, "prd_id", "213", "prd_key", " "));
        assertEquals("prd_key", outcome.getRejectedField());
        assertEquals(RejectionReason.MISSING_MANDATORY_KEY, outcome.getReason());
    }

    @Test
    @DisplayName("Should raise UnparsableValueException for a non-numeric cost")
    void testNormalize_UnparsableCost() {
        assertThrows(UnparsableValueException.class, () -> rules.normalize(raw(SourceEntity.PRODUCT, 1,
                "prd_id", "213", "prd_key", "AC-HE-HL-U509-R", "prd_cost", "12,5x")));
    }

    // ============================================================================
    // postProcess Tests
    // ============================================================================

    @Test
    @DisplayName("Should end each version the day before the next one starts")
    void testPostProcess_Timeline() {
        List<ProductRecord> processed = rules.postProcess(List.of(
                version(3, "CO-RF-FR-R92R-58", LocalDate.of(2008, 1, 1)),
                version(1, "CO-RF-FR-R92R-58", LocalDate.of(2003, 7, 1)),
                version(2, "CO-RF-FR-R92R-58", LocalDate.of(2007, 7, 1)),
                version(4, "AC-HE-HL-U509", LocalDate.of(2011, 7, 1))));

        assertEquals(List.of(3, 1, 2, 4), processed.stream().map(ProductRecord::getPrdId).toList(),
                "output keeps input order");
        assertNull(processed.get(0).getPrdEndDt());
        assertEquals(LocalDate.of(2007, 6, 30), processed.get(1).getPrdEndDt());
        assertEquals(LocalDate.of(2007, 12, 31), processed.get(2).getPrdEndDt());
        assertNull(processed.get(3).getPrdEndDt(), "single version stays open");
    }

    @Test
    @DisplayName("Should order versions without a start date last")
    void testPostProcess_NullStartDate() {
        List<ProductRecord> processed = rules.postProcess(List.of(
                version(1, "K", null),
                version(2, "K", LocalDate.of(2010, 1, 1))));

        assertNull(processed.get(0).getPrdEndDt());
        assertNull(processed.get(1).getPrdEndDt(), "the next version has no start date");
    }

    @Test
    @DisplayName("Should keep versions of different full keys apart")
    void testPostProcess_DifferentSourceKeys() {
        List<ProductRecord> processed = rules.postProcess(List.of(
                version(1, "CO-RF-FR-R92R-58", LocalDate.of(2003, 7, 1)),
                version(2, "CO-RF-FR-R92B-58", LocalDate.of(2007, 7, 1))));

        assertNull(processed.get(0).getPrdEndDt());
        assertNull(processed.get(1).getPrdEndDt());
    }

    private static ProductRecord version(int id, String sourceKey, LocalDate start) {
        return ProductRecord.builder()
                .prdId(id)
                .sourceKey(sourceKey)
                .prdKey(ProductRules.shortKey(sourceKey))
                .catId(ProductRules.categoryKey(sourceKey))
                .prdStartDt(start)
                .build();
    }
}
