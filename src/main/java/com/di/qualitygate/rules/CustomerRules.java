package com.di.qualitygate.rules;

import com.di.qualitygate.dedup.DeduplicationPolicy;
import com.di.qualitygate.dedup.LatestByDate;
import com.di.qualitygate.model.CustomerRecord;
import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.util.DateFormatUtils;
import com.di.qualitygate.util.TypeConverter;
import org.springframework.stereotype.Component;

/**
 * Rules for {@code bronze.crm_cust_info}.
 *
 * <ul>
 *   <li>{@code cst_id} (integer) and {@code cst_key} are mandatory.</li>
 *   <li>Marital status S/M → Single/Married, gender M/F → Male/Female, anything else {@code n/a}.</li>
 *   <li>Duplicates on {@code cst_id}: the row with the latest {@code cst_create_date} wins.</li>
 * </ul>
 */
@Component
public class CustomerRules implements EntityRuleSet<CustomerRecord> {

    private final DeduplicationPolicy<CustomerRecord> deduplicationPolicy =
            new LatestByDate<>("cst_id", CustomerRecord::businessKey, CustomerRecord::getCstCreateDate);

    @Override
    public SourceEntity entity() {
        return SourceEntity.CUSTOMER;
    }

    @Override
    public RuleOutcome<CustomerRecord> normalize(RawRecord raw) {
        String id = raw.text("cst_id");
        if (id == null) {
            return RuleOutcome.missingKey("cst_id");
        }
        String key = raw.text("cst_key");
        if (key == null) {
            return RuleOutcome.missingKey("cst_key");
        }

        return RuleOutcome.accepted(CustomerRecord.builder()
                .cstId(TypeConverter.toInteger("cst_id", id))
                .cstKey(key)
                .cstFirstname(raw.text("cst_firstname"))
                .cstLastname(raw.text("cst_lastname"))
                .cstMaritalStatus(maritalStatus(raw.text("cst_marital_status")))
                .cstGender(gender(raw.text("cst_gender")))
                .cstCreateDate(DateFormatUtils.parseDate("cst_create_date", raw.text("cst_create_date")))
                .build());
    }

    @Override
    public DeduplicationPolicy<CustomerRecord> deduplicationPolicy() {
        return deduplicationPolicy;
    }

    static String maritalStatus(String code) {
        String upper = TypeConverter.code(code);
        if ("S".equals(upper)) return "Single";
        if ("M".equals(upper)) return "Married";
        return "n/a";
    }

    static String gender(String code) {
        String upper = TypeConverter.code(code);
        if ("M".equals(upper)) return "Male";
        if ("F".equals(upper)) return "Female";
        return "n/a";
    }
}
