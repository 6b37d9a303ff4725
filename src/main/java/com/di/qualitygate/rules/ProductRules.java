package com.di.qualitygate.rules;

import com.di.qualitygate.dedup.DeduplicationPolicy;
import com.di.qualitygate.dedup.RejectAllOnConflict;
import com.di.qualitygate.model.ProductRecord;
import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.util.DateFormatUtils;
import com.di.qualitygate.util.TypeConverter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rules for {@code bronze.crm_prd_info}.
 *
 * <p>The staging key {@code CO-RF-FR-R92B-58} is split into the category key
 * {@code CO_RF} (first five characters, hyphens as underscores) and the short
 * product key {@code FR-R92B-58} (from the seventh character on).
 *
 * <p>The source end date is discarded: after deduplication each version ends the
 * day before the next version of the same product key starts, and the latest
 * version stays open (null end date).
 */
@Component
public class ProductRules implements EntityRuleSet<ProductRecord> {

    private static final int CATEGORY_KEY_LENGTH = 5;
    private static final int SHORT_KEY_OFFSET = 6;

    private static final Comparator<ProductRecord> BY_START_DATE =
            Comparator.comparing(ProductRecord::getPrdStartDt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final DeduplicationPolicy<ProductRecord> deduplicationPolicy =
            new RejectAllOnConflict<>("prd_id", ProductRecord::businessKey);

    @Override
    public SourceEntity entity() {
        return SourceEntity.PRODUCT;
    }

    @Override
    public RuleOutcome<ProductRecord> normalize(RawRecord raw) {
        String id = raw.text("prd_id");
        if (id == null) {
            return RuleOutcome.missingKey("prd_id");
        }
        String key = raw.text("prd_key");
        if (key == null) {
            return RuleOutcome.missingKey("prd_key");
        }

        int prdId = TypeConverter.toInteger("prd_id", id);
        BigDecimal cost = TypeConverter.toMoney("prd_cost", raw.text("prd_cost"));
        if (cost == null) {
            cost = TypeConverter.money(BigDecimal.ZERO);
        } else if (cost.signum() < 0) {
            return RuleOutcome.rejected("prd_cost", RejectionReason.NEGATIVE_AMOUNT);
        }

        return RuleOutcome.accepted(ProductRecord.builder()
                .prdId(prdId)
                .prdKey(shortKey(key))
                .catId(categoryKey(key))
                .prdNm(raw.text("prd_nm"))
                .prdCost(cost)
                .prdLine(productLine(raw.text("prd_line")))
                .prdStartDt(DateFormatUtils.parseDate("prd_start_dt", raw.text("prd_start_dt")))
                .sourceKey(key)
                .build());
    }

    @Override
    public DeduplicationPolicy<ProductRecord> deduplicationPolicy() {
        return deduplicationPolicy;
    }

    /**
     * Rebuilds the validity timeline per full product key. Output keeps input order.
     */
    @Override
    public List<ProductRecord> postProcess(List<ProductRecord> accepted) {
        Map<String, List<Integer>> positionsByKey = new LinkedHashMap<>();
        for (int i = 0; i < accepted.size(); i++) {
            positionsByKey.computeIfAbsent(accepted.get(i).getSourceKey(), k -> new ArrayList<>()).add(i);
        }

        List<ProductRecord> result = new ArrayList<>(accepted);
        for (List<Integer> positions : positionsByKey.values()) {
            List<Integer> ordered = new ArrayList<>(positions);
            ordered.sort(Comparator.comparing(accepted::get, BY_START_DATE));
            for (int i = 0; i < ordered.size(); i++) {
                LocalDate nextStart = i + 1 < ordered.size() ? accepted.get(ordered.get(i + 1)).getPrdStartDt() : null;
                int position = ordered.get(i);
                result.set(position, accepted.get(position).withPrdEndDt(nextStart == null ? null : nextStart.minusDays(1)));
            }
        }
        return result;
    }

    static String categoryKey(String key) {
        return key.substring(0, Math.min(CATEGORY_KEY_LENGTH, key.length())).replace('-', '_');
    }

    static String shortKey(String key) {
        return key.length() > SHORT_KEY_OFFSET ? key.substring(SHORT_KEY_OFFSET) : "";
    }

    static String productLine(String code) {
        String upper = TypeConverter.code(code);
        if (upper == null) return "n/a";
        switch (upper) {
            case "M": return "Mountain";
            case "R": return "Road";
            case "S": return "Other sales";
            case "T": return "Touring";
            default:  return "n/a";
        }
    }
}
