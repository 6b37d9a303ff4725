package com.di.qualitygate.rules;

import com.di.qualitygate.dedup.DeduplicationPolicy;
import com.di.qualitygate.dedup.RejectAllOnConflict;
import com.di.qualitygate.model.ErpLocationRecord;
import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.util.TypeConverter;
import org.springframework.stereotype.Component;

/**
 * Rules for {@code bronze.erp_loc_a101}: hyphens are stripped from the id
 * ({@code AW-00011} → {@code AW00011}) and country codes are expanded.
 */
@Component
public class ErpLocationRules implements EntityRuleSet<ErpLocationRecord> {

    private final DeduplicationPolicy<ErpLocationRecord> deduplicationPolicy =
            new RejectAllOnConflict<>("cid", ErpLocationRecord::businessKey);

    @Override
    public SourceEntity entity() {
        return SourceEntity.ERP_LOCATION;
    }

    @Override
    public RuleOutcome<ErpLocationRecord> normalize(RawRecord raw) {
        String cid = cleanId(raw.text("cid"));
        if (cid == null) {
            return RuleOutcome.missingKey("cid");
        }
        return RuleOutcome.accepted(ErpLocationRecord.builder()
                .cid(cid)
                .cntry(country(raw.text("cntry")))
                .build());
    }

    @Override
    public DeduplicationPolicy<ErpLocationRecord> deduplicationPolicy() {
        return deduplicationPolicy;
    }

    static String cleanId(String cid) {
        if (cid == null) {
            return null;
        }
        String stripped = cid.replace("-", "");
        return stripped.isBlank() ? null : stripped;
    }

    static String country(String value) {
        String upper = TypeConverter.code(value);
        if (upper == null) return "n/a";
        if ("US".equals(upper) || "USA".equals(upper)) return "United States";
        if ("DE".equals(upper)) return "Germany";
        return value;
    }
}
