package com.acme.eventlog.schedule;

import com.acme.eventlog.config.EventLogConfig;
import com.acme.eventlog.core.AdaptiveBackoff;
import com.acme.eventlog.core.ConsumerRunLoop;
import com.acme.eventlog.core.TickResult;
import com.acme.eventlog.spi.ConsumerCheckpointStore;
import com.acme.eventlog.spi.EventConsumer;
import com.acme.eventlog.spi.EventLog;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts one fixed-rate, backoff-gated run loop per {@link EventConsumer} bean.
 *
 * <p>Stopping only cancels future ticks; a tick already running finishes its transaction.
 */
@Singleton
@Requires(property = "eventlog.scheduler.enabled", value = "true", defaultValue = "true")
public class ConsumerScheduler implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(ConsumerScheduler.class);

    private final List<EventConsumer> consumers;
    private final EventLog log;
    private final ConsumerCheckpointStore checkpoints;
    private final TaskScheduler taskScheduler;
    private final EventLogConfig config;
    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();

    public ConsumerScheduler(List<EventConsumer> consumers, EventLog log, ConsumerCheckpointStore checkpoints,
                             @Named(TaskExecutors.SCHEDULED) TaskScheduler taskScheduler, EventLogConfig config) {
        this.consumers = consumers;
        this.log = log;
        this.checkpoints = checkpoints;
        this.taskScheduler = taskScheduler;
        this.config = config;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        start();
    }

    synchronized void start() {
        if (!scheduled.isEmpty()) {
            return;
        }
        for (EventConsumer consumer : consumers) {
            ConsumerRunLoop loop = new ConsumerRunLoop(consumer.name(), consumer.topics(), consumer,
                log, checkpoints, config.getBatchSize());
            AdaptiveBackoff backoff = new AdaptiveBackoff(config.getBackoffTableLength(), config.getBackoffBase());
            scheduled.add(taskScheduler.scheduleAtFixedRate(
                config.getTickInterval(), config.getTickInterval(), () -> tick(loop, backoff)));
            LOG.info("Scheduled consumer {} every {} (batch {}, topics {})",
                consumer.name(), config.getTickInterval(), config.getBatchSize(), consumer.topics());
        }
    }

    @PreDestroy
    synchronized void stop() {
        scheduled.forEach(future -> future.cancel(false));
        scheduled.clear();
    }

    int scheduledCount() {
        return scheduled.size();
    }

    static void tick(ConsumerRunLoop loop, AdaptiveBackoff backoff) {
        try {
            backoff.runIfDue(() -> {
                TickResult result = loop.tick();
                if (result.status() == TickResult.Status.FAILED) {
                    LOG.warn("{}: tick failed at checkpoint {} after {} processed", loop.name(),
                        result.checkpoint(), result.processed());
                }
                return result.productive();
            });
        } catch (Throwable t) {
            // anything escaping here would cancel the periodic task for good
            LOG.error("{}: tick aborted: {}", loop.name(), t.toString(), t);
        }
    }
}
