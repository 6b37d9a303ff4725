package com.di.qualitygate.config;

import com.di.qualitygate.gate.UnparsableValuePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Single binding for the engine's configuration.
 *
 * <pre>
 * qualitygate:
 *   store:
 *     type: jdbc                     # jdbc | memory
 *   batch:
 *     run-on-startup: false
 *     unparsable-value-policy: FAIL_ENTITY
 *   rules:
 *     birth-date-max-age-years: 120
 *     enforce-sales-chronology: true
 *   quarantine:
 *     log-sample-size: 20
 *     max-payload-chars: 2000
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "qualitygate")
public class QualityGateProperties {

    @Valid
    private Store store = new Store();
    @Valid
    private Batch batch = new Batch();
    @Valid
    private Rules rules = new Rules();
    @Valid
    private Quarantine quarantine = new Quarantine();

    @Data
    public static class Store {
        /** {@code jdbc} (default) reads bronze and writes silver through the datasource; {@code memory} keeps everything on the heap. */
        @Pattern(regexp = "jdbc|memory", message = "qualitygate.store.type must be jdbc or memory")
        private String type = "jdbc";
    }

    @Data
    public static class Batch {
        /** Run one batch when the application starts. */
        private boolean runOnStartup = false;

        @NotNull
        private UnparsableValuePolicy unparsableValuePolicy = UnparsableValuePolicy.FAIL_ENTITY;
    }

    @Data
    public static class Rules {
        /** ERP birth dates older than this many years before today are nulled. */
        @Min(1)
        private int birthDateMaxAgeYears = 120;

        /** Quarantine sales lines ordered after they were shipped or due. */
        private boolean enforceSalesChronology = true;
    }

    @Data
    public static class Quarantine {
        /** Quarantined rows logged individually per entity; 0 logs counts only. */
        @Min(0)
        private int logSampleSize = 20;

        /** Raw payloads longer than this are truncated in logs. */
        @Min(16)
        private int maxPayloadChars = 2000;
    }
}
