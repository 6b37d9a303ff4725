package com.di.qualitygate.rules;

import com.di.qualitygate.config.QualityGateProperties;
import com.di.qualitygate.dedup.DeduplicationPolicy;
import com.di.qualitygate.dedup.RejectAllOnConflict;
import com.di.qualitygate.model.ErpCustomerDemoRecord;
import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.util.DateFormatUtils;
import com.di.qualitygate.util.TypeConverter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Rules for {@code bronze.erp_cust_az12}.
 *
 * <p>ERP customer ids carry a {@code NAS} prefix and sometimes hyphens
 * ({@code NAS-AW00011}); both are removed so the id lines up with
 * {@code crm_cust_info.cst_key} ({@code AW00011}). Birth dates in the future or
 * more than {@code birth-date-max-age-years} in the past are nulled.
 */
@Component
public class ErpCustomerDemoRules implements EntityRuleSet<ErpCustomerDemoRecord> {

    private static final String LEGACY_PREFIX = "NAS";

    private final DeduplicationPolicy<ErpCustomerDemoRecord> deduplicationPolicy =
            new RejectAllOnConflict<>("cid", ErpCustomerDemoRecord::businessKey);
    private final Clock clock;
    private final QualityGateProperties properties;

    public ErpCustomerDemoRules(Clock clock, QualityGateProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    @Override
    public SourceEntity entity() {
        return SourceEntity.ERP_CUSTOMER_DEMO;
    }

    @Override
    public RuleOutcome<ErpCustomerDemoRecord> normalize(RawRecord raw) {
        String cid = cleanId(raw.text("cid"));
        if (cid == null) {
            return RuleOutcome.missingKey("cid");
        }
        return RuleOutcome.accepted(ErpCustomerDemoRecord.builder()
                .cid(cid)
                .bdate(sanitizeBirthDate(DateFormatUtils.parseDate("bdate", raw.text("bdate"))))
                .gen(gender(raw.text("gen")))
                .build());
    }

    @Override
    public DeduplicationPolicy<ErpCustomerDemoRecord> deduplicationPolicy() {
        return deduplicationPolicy;
    }

    LocalDate sanitizeBirthDate(LocalDate birthDate) {
        if (birthDate == null) {
            return null;
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate oldest = today.minusYears(properties.getRules().getBirthDateMaxAgeYears());
        if (birthDate.isAfter(today) || birthDate.isBefore(oldest)) {
            return null;
        }
        return birthDate;
    }

    static String cleanId(String cid) {
        if (cid == null) {
            return null;
        }
        String stripped = cid.startsWith(LEGACY_PREFIX) ? cid.substring(LEGACY_PREFIX.length()) : cid;
        stripped = stripped.replace("-", "").trim();
        return stripped.isEmpty() ? null : stripped;
    }

    static String gender(String code) {
        String upper = TypeConverter.code(code);
        if ("M".equals(upper) || "MALE".equals(upper)) return "Male";
        if ("F".equals(upper) || "FEMALE".equals(upper)) return "Female";
        return "n/a";
    }
}
