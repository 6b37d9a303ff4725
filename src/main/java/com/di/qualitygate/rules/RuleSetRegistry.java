package com.di.qualitygate.rules;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.SourceEntity;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registry of the {@link EntityRuleSet} beans, one per {@link SourceEntity}.
 *
 * <p>Fails at startup if two rule sets claim the same entity or if an entity
 * has none, so that a batch can never reach an entity without rules.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleSetRegistry {

    private final List<EntityRuleSet<?>> ruleSets;

    private Map<SourceEntity, EntityRuleSet<?>> ruleSetsByEntity;

    @PostConstruct
    void initialize() {
        log.info("Discovering {} EntityRuleSet bean(s)...", ruleSets.size());

        Map<SourceEntity, EntityRuleSet<?>> registered = new EnumMap<>(SourceEntity.class);
        for (EntityRuleSet<?> ruleSet : ruleSets) {
            EntityRuleSet<?> previous = registered.putIfAbsent(ruleSet.entity(), ruleSet);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate rule sets for entity %s: %s and %s",
                        ruleSet.entity(), previous.getClass().getSimpleName(), ruleSet.getClass().getSimpleName()));
            }
        }

        List<SourceEntity> missing = Arrays.stream(SourceEntity.values())
                .filter(entity -> !registered.containsKey(entity))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No rule set registered for entities: " + missing);
        }

        ruleSetsByEntity = Collections.unmodifiableMap(registered);
        log.info("Registered rule sets: {}", ruleSetsByEntity.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().getClass().getSimpleName())
                .collect(Collectors.joining(", ")));
    }

    /**
     * @throws IllegalArgumentException if no rule set is registered for the entity
     */
    @SuppressWarnings("unchecked")
    public <T extends CleanRecord> EntityRuleSet<T> getRuleSet(SourceEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("Entity cannot be null");
        }
        EntityRuleSet<?> ruleSet = ruleSetsByEntity.get(entity);
        if (ruleSet == null) {
            throw new IllegalArgumentException(String.format(
                    "No rule set for entity '%s'. Available: %s", entity, ruleSetsByEntity.keySet()));
        }
        return (EntityRuleSet<T>) ruleSet;
    }

    public boolean hasRuleSet(SourceEntity entity) {
        return entity != null && ruleSetsByEntity.containsKey(entity);
    }
}
