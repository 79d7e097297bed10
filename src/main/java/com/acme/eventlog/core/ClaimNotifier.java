package com.acme.eventlog.core;

import com.acme.eventlog.claim.ExclusiveClaimWorker;
import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.TransactionOperations;
import io.micronaut.transaction.support.TransactionSynchronization;
import jakarta.inject.Singleton;
import java.sql.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process push hint: once the producing transaction commits, asks the claim worker to take
 * the new event right away. Hints are fire-and-forget; whatever is missed here is picked up by
 * the worker's sweep.
 */
@Singleton
@Requires(beans = ExclusiveClaimWorker.class)
public class ClaimNotifier {
    private static final Logger LOG = LoggerFactory.getLogger(ClaimNotifier.class);

    private final TransactionOperations<Connection> transactionOps;
    private final ExclusiveClaimWorker worker;

    public ClaimNotifier(TransactionOperations<Connection> transactionOps, ExclusiveClaimWorker worker) {
        this.transactionOps = transactionOps;
        this.worker = worker;
    }

    public void registerAfterCommit(long eventId) {
        transactionOps.findTransactionStatus().ifPresent(status -> {
            status.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    try {
                        worker.onNotification(eventId);
                    } catch (Exception e) {
                        LOG.warn("Fast-path claim of event {} failed, leaving it to the sweep: {}",
                            eventId, e.getMessage());
                    }
                }
            });
        });
    }
}
