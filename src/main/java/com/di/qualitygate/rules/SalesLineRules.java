package com.di.qualitygate.rules;

import com.di.qualitygate.config.QualityGateProperties;
import com.di.qualitygate.dedup.DeduplicationPolicy;
import com.di.qualitygate.dedup.KeepAll;
import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SalesLineRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.util.DateFormatUtils;
import com.di.qualitygate.util.TypeConverter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Rules for {@code bronze.crm_sales_details}.
 *
 * <p>Financial reconciliation, in this order:
 * <ol>
 *   <li>price missing or zero → sales ÷ quantity (null when quantity is zero);</li>
 *   <li>sales missing or different from quantity × price → quantity × price, using
 *       the reconciled price when there is one and the source price otherwise.</li>
 * </ol>
 * Negative amounts are kept: they are returns.
 */
@Component
public class SalesLineRules implements EntityRuleSet<SalesLineRecord> {

    private final DeduplicationPolicy<SalesLineRecord> deduplicationPolicy = new KeepAll<>();
    private final QualityGateProperties properties;

    public SalesLineRules(QualityGateProperties properties) {
        this.properties = properties;
    }

    @Override
    public SourceEntity entity() {
        return SourceEntity.SALES_LINE;
    }

    @Override
    public RuleOutcome<SalesLineRecord> normalize(RawRecord raw) {
        String orderNumber = raw.text("sls_ord_num");
        if (orderNumber == null) {
            return RuleOutcome.missingKey("sls_ord_num");
        }
        String productKey = raw.text("sls_prd_key");
        if (productKey == null) {
            return RuleOutcome.missingKey("sls_prd_key");
        }
        String customerId = raw.text("sls_cus_id");
        if (customerId == null) {
            return RuleOutcome.missingKey("sls_cus_id");
        }

        int cusId = TypeConverter.toInteger("sls_cus_id", customerId);
        LocalDate orderDate = DateFormatUtils.parseCompactDate("sls_ord_dt", raw.text("sls_ord_dt"));
        LocalDate shipDate = DateFormatUtils.parseCompactDate("sls_ship_dt", raw.text("sls_ship_dt"));
        LocalDate dueDate = DateFormatUtils.parseCompactDate("sls_due_dt", raw.text("sls_due_dt"));

        if (properties.getRules().isEnforceSalesChronology() && !isChronological(orderDate, shipDate, dueDate)) {
            return RuleOutcome.rejected("sls_ord_dt", RejectionReason.INVALID_DATE_CHRONOLOGY);
        }

        Integer quantity = TypeConverter.toInteger("sls_quantity", raw.text("sls_quantity"));
        BigDecimal sourcePrice = TypeConverter.toMoney("sls_price", raw.text("sls_price"));
        BigDecimal sourceSales = TypeConverter.toMoney("sls_sales", raw.text("sls_sales"));

        BigDecimal price = reconcilePrice(quantity, sourcePrice, sourceSales);
        BigDecimal sales = reconcileSales(quantity, price != null ? price : sourcePrice, sourceSales);

        return RuleOutcome.accepted(SalesLineRecord.builder()
                .slsOrdNum(orderNumber)
                .slsPrdKey(productKey)
                .slsCusId(cusId)
                .slsOrdDt(orderDate)
                .slsShipDt(shipDate)
                .slsDueDt(dueDate)
                .slsSales(sales)
                .slsQuantity(quantity)
                .slsPrice(price)
                .build());
    }

    @Override
    public DeduplicationPolicy<SalesLineRecord> deduplicationPolicy() {
        return deduplicationPolicy;
    }

    static BigDecimal reconcilePrice(Integer quantity, BigDecimal price, BigDecimal sales) {
        if (price != null && price.signum() != 0) {
            return price;
        }
        if (sales == null || quantity == null || quantity == 0) {
            return null;
        }
        return sales.divide(BigDecimal.valueOf(quantity), TypeConverter.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal reconcileSales(Integer quantity, BigDecimal price, BigDecimal sales) {
        if (quantity == null || price == null) {
            return sales;
        }
        BigDecimal expected = TypeConverter.money(price.multiply(BigDecimal.valueOf(quantity)));
        if (sales == null || sales.compareTo(expected) != 0) {
            return expected;
        }
        return sales;
    }

    static boolean isChronological(LocalDate orderDate, LocalDate shipDate, LocalDate dueDate) {
        if (orderDate == null) {
            return true;
        }
        return (shipDate == null || !orderDate.isAfter(shipDate))
                && (dueDate == null || !orderDate.isAfter(dueDate));
    }
}
