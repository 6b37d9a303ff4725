package com.di.qualitygate.rules;

import com.di.qualitygate.config.QualityGateProperties;
import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SalesLineRecord;
import com.di.qualitygate.model.SourceEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;

import static com.di.qualitygate.support.QualityGateFixtures.raw;
import static com.di.qualitygate.support.QualityGateFixtures.salesLine;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SalesLineRules Tests")
class SalesLineRulesTest {

    private QualityGateProperties properties;
    private SalesLineRules rules;

    @BeforeEach
    void setUp() {
        properties = new QualityGateProperties();
        rules = new SalesLineRules(properties);
    }

    // ============================================================================
    // Financial reconciliation Tests
    // ============================================================================

    @ParameterizedTest
    @CsvSource(value = {
        // quantity, price, sales, expected price, expected sales
        "2, 10, NULL, 10.00, 20.00",
        "5, 0, 100, 20.00, 100.00",
        "0, 0, NULL, NULL, 0.00",
        "1, 50, 40, 50.00, 50.00",
        "3, NULL, 10, 3.33, 9.99",
        "2, -10, -20, -10.00, -20.00",
        "NULL, 10, 30, 10.00, 30.00"
    }, nullValues = "NULL")
    @DisplayName("Should reconcile price and sales")
    void testReconciliation(Integer quantity, String price, String sales, String expectedPrice, String expectedSales) {
        BigDecimal sourcePrice = price == null ? null : new BigDecimal(price).setScale(2);
        BigDecimal sourceSales = sales == null ? null : new BigDecimal(sales).setScale(2);

        BigDecimal reconciledPrice = SalesLineRules.reconcilePrice(quantity, sourcePrice, sourceSales);
        BigDecimal reconciledSales = SalesLineRules.reconcileSales(quantity,
                reconciledPrice != null ? reconciledPrice : sourcePrice, sourceSales);

        assertEquals(expectedPrice == null ? null : new BigDecimal(expectedPrice), reconciledPrice);
        assertEquals(expectedSales == null ? null : new BigDecimal(expectedSales), reconciledSales);
    }

    @Test
    @DisplayName("Should keep source sales when quantity is zero and no price can be derived")
    void testNormalize_ZeroQuantity() {
        SalesLineRecord record = rules.normalize(raw(SourceEntity.SALES_LINE, 1,
                "sls_ord_num", "SO1", "sls_prd_key", "BK-1", "sls_cus_id", "1",
                "sls_sales", "0", "sls_quantity", "0", "sls_price", "0")).getRecord();

        assertNull(record.getSlsPrice());
        assertEquals(new BigDecimal("0.00"), record.getSlsSales());
        assertEquals(0, record.getSlsQuantity());
    }

    // ============================================================================
    // Date Tests
    // ============================================================================

    @Test
    @DisplayName("Should parse compact dates and null placeholders")
    void testNormalize_Dates() {
        SalesLineRecord record = rules.normalize(raw(SourceEntity.SALES_LINE, 1,
                "sls_ord_num", "SO1", "sls_prd_key", "BK-1", "sls_cus_id", "21768",
                "sls_ord_dt", "0", "sls_ship_dt", "20101229", "sls_due_dt", "2011011",
                "sls_sales", "10", "sls_quantity", "1", "sls_price", "10")).getRecord();

        assertNull(record.getSlsOrdDt());
        assertEquals(LocalDate.of(2010, 12, 29), record.getSlsShipDt());
        assertNull(record.getSlsDueDt(), "seven digits is a placeholder");
        assertEquals(21768, record.getSlsCusId());
    }

    @Test
    @DisplayName("Should reject an order placed after it shipped")
    void testNormalize_ChronologyViolation() {
        RuleOutcome<SalesLineRecord> outcome = rules.normalize(new com.di.qualitygate.model.RawRecord(
                SourceEntity.SALES_LINE, 1, salesLine("SO1", "BK-1", "1", "20110115", "50", "1", "50")));

        assertFalse(outcome.isAccepted());
        assertEquals("sls_ord_dt", outcome.getRejectedField());
        assertEquals(RejectionReason.INVALID_DATE_CHRONOLOGY, outcome.getReason());
    }

    @Test
    @DisplayName("Should accept out-of-order dates when chronology is not enforced")
    void testNormalize_ChronologyDisabled() {
        properties.getRules().setEnforceSalesChronology(false);
        RuleOutcome<SalesLineRecord> outcome = rules.normalize(new com.di.qualitygate.model.RawRecord(
                SourceEntity.SALES_LINE, 1, salesLine("SO1", "BK-1", "1", "20110115", "50", "1", "50")));

        assertTrue(outcome.isAccepted());
    }

    @ParameterizedTest
    @CsvSource(value = {
        "2011-01-01, 2011-01-05, 2011-01-10, true",
        "2011-01-05, 2011-01-05, 2011-01-05, true",
        "2011-01-06, 2011-01-05, 2011-01-10, false",
        "2011-01-11, NULL, 2011-01-10, false",
        "NULL, 2011-01-05, 2011-01-10, true"
    }, nullValues = "NULL")
    @DisplayName("Should check order date against ship and due dates")
    void testIsChronological(LocalDate order, LocalDate ship, LocalDate due, boolean expected) {
        assertEquals(expected, SalesLineRules.isChronological(order, ship, due));
    }

    // ============================================================================
    // Mandatory keys / unparsable values
    // ============================================================================

    @ParameterizedTest
    @CsvSource(value = {
        "NULL, BK-1, 1, sls_ord_num",
        "SO1, NULL, 1, sls_prd_key",
        "SO1, BK-1, ' ', sls_cus_id"
    }, nullValues = "NULL")
    @DisplayName("Should reject rows without a mandatory key")
    void testNormalize_MissingKey(String orderNumber, String productKey, String customerId, String expectedField) {
        RuleOutcome<SalesLineRecord> outcome = rules.normalize(raw(SourceEntity.SALES_LINE, 1,
                "sls_ord_num", orderNumber, "sls_prd_key", productKey, "sls_cus_id", customerId));

        assertEquals(expectedField, outcome.getRejectedField());
        assertEquals(RejectionReason.MISSING_MANDATORY_KEY, outcome.getReason());
    }

    @Test
    @DisplayName("Should raise UnparsableValueException for an eight-character value that is not a date")
    void testNormalize_UnparsableDate() {
        UnparsableValueException e = assertThrows(UnparsableValueException.class, () -> rules.normalize(raw(
                SourceEntity.SALES_LINE, 1, "sls_ord_num", "SO1", "sls_prd_key", "BK-1", "sls_cus_id", "1",
                "sls_ord_dt", "2010AB29")));
        assertEquals("sls_ord_dt", e.getField());
    }

    @Test
    @DisplayName("Should null dates that are not eight characters long instead of failing")
    void testNormalize_WrongLengthDates() {
        RuleOutcome<SalesLineRecord> outcome = rules.normalize(raw(
                SourceEntity.SALES_LINE, 1, "sls_ord_num", "SO1", "sls_prd_key", "BK-1", "sls_cus_id", "1",
                "sls_ord_dt", "2010-12-29", "sls_ship_dt", "N/A", "sls_due_dt", "20110110",
                "sls_sales", "10", "sls_quantity", "1", "sls_price", "10"));

        assertTrue(outcome.isAccepted());
        assertNull(outcome.getRecord().getSlsOrdDt());
        assertNull(outcome.getRecord().getSlsShipDt());
        assertEquals(LocalDate.of(2011, 1, 10), outcome.getRecord().getSlsDueDt());
    }
}
