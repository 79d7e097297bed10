package com.acme.eventlog.claim;

import com.acme.eventlog.config.EventLogConfig;
import com.acme.eventlog.core.AdaptiveBackoff;
import com.acme.eventlog.core.ProcessingException;
import com.acme.eventlog.spi.ClaimedEventHandler;
import com.acme.eventlog.spi.EventLog;
import com.acme.eventlog.spi.EventLog.Event;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import io.micronaut.transaction.TransactionOperations;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream-mode processing: each event is claimed, handled and deleted in one transaction, so at
 * most one worker holds a given event at any time.
 *
 * <p>Push hints go through {@link #onNotification(long)}. Hints can be lost, so a backoff-gated
 * sweep also drains whatever is left with opportunistic claims. Both paths may race for the same
 * event; the losing claim simply comes back empty.
 */
@Singleton
@Requires(property = "eventlog.claim.enabled", value = "true")
@Requires(beans = ClaimedEventHandler.class)
public class ExclusiveClaimWorker {
    private static final Logger LOG = LoggerFactory.getLogger(ExclusiveClaimWorker.class);

    private final EventLog log;
    private final TransactionOperations<Connection> transactionOps;
    private final ClaimedEventHandler handler;
    private final int sweepLimit;
    private final AdaptiveBackoff backoff;

    @Inject
    public ExclusiveClaimWorker(EventLog log, TransactionOperations<Connection> transactionOps,
                                ClaimedEventHandler handler, EventLogConfig config) {
        this(log, transactionOps, handler, config.getClaim().getSweepLimit(),
            new AdaptiveBackoff(config.getBackoffTableLength(), config.getBackoffBase()));
    }

    ExclusiveClaimWorker(EventLog log, TransactionOperations<Connection> transactionOps,
                         ClaimedEventHandler handler, int sweepLimit, AdaptiveBackoff backoff) {
        this.log = log;
        this.transactionOps = transactionOps;
        this.handler = handler;
        this.sweepLimit = sweepLimit;
        this.backoff = backoff;
    }

    /**
     * Handles the event named by a push hint.
     *
     * @throws ProcessingException if the handler fails; the claim is rolled back and the event kept
     */
    public ClaimOutcome onNotification(long eventId) {
        return transactionOps.executeWrite(status -> {
            Optional<Event> claimed = log.claimOne(eventId);
            if (claimed.isEmpty()) {
                LOG.debug("Event {} not claimed, duplicate hint or already processed", eventId);
                return ClaimOutcome.NOT_CLAIMED;
            }
            process(claimed.get());
            return ClaimOutcome.PROCESSED;
        });
    }

    /**
     * Claims and processes up to the sweep limit of unlocked events. Stops early when nothing is
     * left to claim or a handler fails.
     *
     * @return number of events processed
     */
    public int sweep() {
        int processed = 0;
        while (processed < sweepLimit) {
            Optional<Long> done;
            try {
                done = transactionOps.executeWrite(status -> log.claimOne().map(event -> {
                    process(event);
                    return event.id();
                }));
            } catch (ProcessingException e) {
                LOG.warn("Sweep stopped: {}", e.getMessage(), e);
                break;
            }
            if (done.isEmpty()) {
                break;
            }
            processed++;
        }
        if (processed > 0) {
            LOG.debug("Sweep processed {} event(s)", processed);
        }
        return processed;
    }

    @Scheduled(fixedRate = "${eventlog.tick-interval:1s}")
    void sweepTick() {
        try {
            backoff.runIfDue(() -> sweep() > 0);
        } catch (RuntimeException e) {
            LOG.warn("Claim sweep failed: {}", e.getMessage(), e);
        }
    }

    private void process(Event event) {
        try {
            handler.handle(event);
        } catch (Exception e) {
            throw new ProcessingException(event.id(), e);
        }
        log.deleteOne(event.id());
    }
}
