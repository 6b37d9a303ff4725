package com.di.qualitygate.gate;

import com.di.qualitygate.config.QualityGateProperties;
import com.di.qualitygate.dedup.Candidate;
import com.di.qualitygate.dedup.DeduplicationPolicy;
import com.di.qualitygate.dedup.DeduplicationResult;
import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.QuarantineRecord;
import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.Rejection;
import com.di.qualitygate.model.RejectionReason;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.rules.EntityRuleSet;
import com.di.qualitygate.rules.RuleOutcome;
import com.di.qualitygate.rules.RuleSetRegistry;
import com.di.qualitygate.rules.UnparsableValueException;
import com.di.qualitygate.store.StagingReader;
import com.di.qualitygate.util.QuarantineLogging;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Cleanses one entity end to end:
 *
 * <pre>
 *   staging rows ──normalize──► candidates ──dedup──► accepted ──postProcess──► stamped
 *        │                          │                                            │
 *        └── rule rejections ───────┴── duplicate rejections ──► quarantine ────┤
 *                                                                                ▼
 *                                                    publish (one transaction)
 * </pre>
 *
 * <p>Everything up to the publish step happens in memory, so an entity that
 * fails before publishing leaves its cleansed table as it was.
 */
@Slf4j
@Service
public class QualityGate {

    private final RuleSetRegistry ruleSetRegistry;
    private final StagingReader stagingReader;
    private final EntityPublisher publisher;
    private final QualityGateProperties properties;

    public QualityGate(RuleSetRegistry ruleSetRegistry,
                       StagingReader stagingReader,
                       EntityPublisher publisher,
                       QualityGateProperties properties) {
        this.ruleSetRegistry = ruleSetRegistry;
        this.stagingReader = stagingReader;
        this.publisher = publisher;
        this.properties = properties;
    }

    /**
     * Reads, cleanses and publishes one entity.
     *
     * @param runTimestamp lineage timestamp stamped on every accepted and quarantined row
     * @throws EntityProcessingException if the entity cannot be processed; nothing was published
     */
    public GateResult process(SourceEntity entity, Instant runTimestamp) {
        try {
            return process(ruleSetRegistry.<CleanRecord>getRuleSet(entity), runTimestamp);
        } catch (EntityProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EntityProcessingException(entity, e);
        }
    }

    private <T extends CleanRecord> GateResult process(EntityRuleSet<T> rules, Instant runTimestamp) {
        SourceEntity entity = rules.entity();
        List<RawRecord> rawRecords = stagingReader.readAll(entity);

        List<Candidate<T>> candidates = new ArrayList<>(rawRecords.size());
        List<Rejection> rejections = new ArrayList<>();
        for (RawRecord raw : rawRecords) {
            RuleOutcome<T> outcome = normalize(rules, raw);
            if (outcome.isAccepted()) {
                candidates.add(new Candidate<>(raw, outcome.getRecord()));
            } else {
                rejections.add(new Rejection(raw, outcome.getRejectedField(), outcome.getReason()));
            }
        }

        DeduplicationPolicy<T> policy = rules.deduplicationPolicy();
        DeduplicationResult<T> deduplicated = policy.resolve(candidates);
        rejections.addAll(deduplicated.rejected());

        List<T> accepted = deduplicated.accepted().stream().map(Candidate::record).collect(Collectors.toList());
        List<T> processed = rules.postProcess(accepted);
        if (processed.size() != accepted.size()) {
            throw new IllegalStateException(String.format(
                    "Post-processing of %s changed the accepted set size from %d to %d",
                    entity, accepted.size(), processed.size()));
        }

        List<CleanRecord> stamped = processed.stream()
                .map(r -> r.stampedAt(runTimestamp))
                .collect(Collectors.toList());
        rejections.sort(Comparator.comparingLong(r -> r.raw().getOrdinal()));
        List<QuarantineRecord> quarantined = rejections.stream()
                .map(r -> r.toQuarantine(runTimestamp))
                .collect(Collectors.toList());

        if (stamped.size() + quarantined.size() != rawRecords.size()) {
            throw new IllegalStateException(String.format(
                    "Row count mismatch for %s: %d accepted + %d rejected != %d source rows",
                    entity, stamped.size(), quarantined.size(), rawRecords.size()));
        }

        publisher.publish(entity, stamped, quarantined);

        Map<RejectionReason, Long> rejectedByReason = QuarantineLogging.countByReason(rejections);
        QuarantineLogging.logCounts(entity, rejectedByReason);
        QuarantineLogging.logSample(rejections,
                properties.getQuarantine().getLogSampleSize(),
                properties.getQuarantine().getMaxPayloadChars());

        return GateResult.builder()
                .entity(entity)
                .sourceCount(rawRecords.size())
                .acceptedCount(stamped.size())
                .rejectedByReason(rejectedByReason)
                .deduplicationPolicy(policy.name())
                .build();
    }

    private <T extends CleanRecord> RuleOutcome<T> normalize(EntityRuleSet<T> rules, RawRecord raw) {
        try {
            return rules.normalize(raw);
        } catch (UnparsableValueException e) {
            if (properties.getBatch().getUnparsableValuePolicy() == UnparsableValuePolicy.QUARANTINE_ROW) {
                log.debug("Row {} of {} quarantined: {}", raw.getOrdinal(), raw.getEntity().stagingTable(), e.getMessage());
                return RuleOutcome.rejected(e.getField(), RejectionReason.UNPARSABLE_VALUE);
            }
            throw new EntityProcessingException(raw.getEntity(), String.format(
                    "Entity %s failed at staging row %d, column %s: %s",
                    raw.getEntity(), raw.getOrdinal(), e.getField(), e.getMessage()), e);
        }
    }
}
