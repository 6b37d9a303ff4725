package com.di.qualitygate.gate;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.QuarantineRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.store.CleansedStore;
import com.di.qualitygate.store.QuarantineSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;

/**
 * Publishes one entity: replaces its cleansed table and appends its quarantined
 * rows in a single transaction. Without a transaction manager (memory store)
 * the two writes run without one.
 */
@Slf4j
@Component
public class EntityPublisher {

    private final CleansedStore cleansedStore;
    private final QuarantineSink quarantineSink;
    private final TransactionOperations transactionOperations;

    public EntityPublisher(CleansedStore cleansedStore,
                           QuarantineSink quarantineSink,
                           ObjectProvider<TransactionOperations> transactionOperations) {
        this.cleansedStore = cleansedStore;
        this.quarantineSink = quarantineSink;
        this.transactionOperations = transactionOperations.getIfAvailable(TransactionOperations::withoutTransaction);
    }

    public void publish(SourceEntity entity, List<? extends CleanRecord> accepted, List<QuarantineRecord> quarantined) {
        transactionOperations.executeWithoutResult(status -> {
            cleansedStore.replace(entity, accepted);
            quarantineSink.append(quarantined);
        });
        log.debug("[PUBLISH] {}: {} accepted, {} quarantined", entity, accepted.size(), quarantined.size());
    }
}
