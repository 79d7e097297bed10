package com.acme.eventlog.core;

import com.acme.eventlog.spi.ConsumerCheckpointStore;
import com.acme.eventlog.spi.ConsumerCheckpointStore.Consumer;
import com.acme.eventlog.spi.EventHandler;
import com.acme.eventlog.spi.EventLog;
import com.acme.eventlog.spi.EventLog.Event;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cursor-mode tick for one named consumer: upsert, filter, scan, process, advance, truncate.
 *
 * <p>Events are handled in ascending id order. Filtered events count as consumed and are never
 * revisited. A handler failure stops the batch at the last good id so the failing event is the
 * first one scanned on the next tick. Store failures abort the tick before anything else is written.
 */
public class ConsumerRunLoop {
    private static final Logger LOG = LoggerFactory.getLogger(ConsumerRunLoop.class);

    private final String name;
    private final Set<String> declaredTopics;
    private final EventHandler handler;
    private final EventLog log;
    private final ConsumerCheckpointStore checkpoints;
    private final int batchSize;

    /**
     * @param declaredTopics topics to enforce on the consumer row, or {@code null} to use whatever
     *                       is stored
     */
    public ConsumerRunLoop(String name, Set<String> declaredTopics, EventHandler handler,
                           EventLog log, ConsumerCheckpointStore checkpoints, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        this.name = name;
        this.declaredTopics = declaredTopics == null ? null : Set.copyOf(declaredTopics);
        this.handler = handler;
        this.log = log;
        this.checkpoints = checkpoints;
        this.batchSize = batchSize;
    }

    public String name() {
        return name;
    }

    public TickResult tick() {
        Consumer consumer;
        List<Event> events;
        try {
            consumer = syncTopics(checkpoints.upsert(name));
            events = log.scanSince(consumer.checkpoint(), batchSize);
        } catch (RuntimeException e) {
            LOG.warn("{}: store unavailable before scan: {}", name, e.getMessage(), e);
            return TickResult.failed(0, 0, -1, 0);
        }

        if (events.isEmpty()) {
            LOG.trace("{}: no events after {}", name, consumer.checkpoint());
            return TickResult.idle(consumer.checkpoint());
        }

        TopicFilter filter = TopicFilter.of(consumer.topics());
        long start = consumer.checkpoint();
        long tentative = start;
        int processed = 0;
        int skipped = 0;
        ProcessingException failure = null;

        for (Event event : events) {
            if (!filter.matches(event.eventType())) {
                LOG.debug("{}: skipping event {} ({})", name, event.id(), event.eventType());
                tentative = event.id();
                skipped++;
                continue;
            }
            try {
                handler.handle(event);
            } catch (Exception e) {
                failure = new ProcessingException(event.id(), e);
                LOG.warn("{}: {}; batch stops at checkpoint {}", name, failure.getMessage(), tentative, e);
                break;
            }
            tentative = event.id();
            processed++;
        }

        long truncated;
        boolean advanced = false;
        try {
            if (tentative > start) {
                boolean updated = checkpoints.advanceCheckpoint(name, tentative);
                advanced = true;
                LOG.debug("{}: checkpoint {} -> {} (updated={})", name, start, tentative, updated);
            }
            truncated = truncate();
        } catch (RuntimeException e) {
            LOG.warn("{}: store failure after processing up to {}: {}", name, tentative, e.getMessage(), e);
            if (!advanced) {
                // nothing was committed; the batch is delivered again
                return TickResult.failed(0, 0, start, 0);
            }
            return TickResult.failed(processed, skipped, tentative, 0);
        }

        if (failure != null) {
            return TickResult.failed(processed, skipped, tentative, truncated);
        }
        LOG.debug("{}: processed {}, skipped {}, truncated {}", name, processed, skipped, truncated);
        return new TickResult(TickResult.Status.PROCESSED, processed, skipped, tentative, truncated);
    }

    private Consumer syncTopics(Consumer consumer) {
        if (declaredTopics == null || declaredTopics.equals(consumer.topics())) {
            return consumer;
        }
        LOG.info("{}: topics {} -> {}", name, consumer.topics(), declaredTopics);
        checkpoints.subscribe(name, declaredTopics);
        return consumer.withTopics(declaredTopics);
    }

    private long truncate() {
        OptionalLong watermark = checkpoints.minCheckpoint();
        if (watermark.isEmpty()) {
            LOG.debug("{}: no consumers registered, truncation skipped", name);
            return 0;
        }
        return log.deleteUpTo(watermark.getAsLong());
    }
}
