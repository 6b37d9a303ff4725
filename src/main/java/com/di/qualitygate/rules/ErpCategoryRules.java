package com.di.qualitygate.rules;

import com.di.qualitygate.dedup.DeduplicationPolicy;
import com.di.qualitygate.dedup.RejectAllOnConflict;
import com.di.qualitygate.model.ErpCategoryRecord;
import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;
import org.springframework.stereotype.Component;

/**
 * Rules for {@code bronze.erp_px_cat_g1v2}: trim only.
 */
@Component
public class ErpCategoryRules implements EntityRuleSet<ErpCategoryRecord> {

    private final DeduplicationPolicy<ErpCategoryRecord> deduplicationPolicy =
            new RejectAllOnConflict<>("id", ErpCategoryRecord::businessKey);

    @Override
    public SourceEntity entity() {
        return SourceEntity.ERP_CATEGORY;
    }

    @Override
    public RuleOutcome<ErpCategoryRecord> normalize(RawRecord raw) {
        String id = raw.text("id");
        if (id == null) {
            return RuleOutcome.missingKey("id");
        }
        return RuleOutcome.accepted(ErpCategoryRecord.builder()
                .id(id)
                .cat(raw.text("cat"))
                .subcat(raw.text("subcat"))
                .maintenance(raw.text("maintenance"))
                .build());
    }

    @Override
    public DeduplicationPolicy<ErpCategoryRecord> deduplicationPolicy() {
        return deduplicationPolicy;
    }
}
