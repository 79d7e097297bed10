package com.acme.eventlog.core;

import com.acme.eventlog.spi.EventLog;
import com.acme.eventlog.spi.EventLog.Event;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;

/**
 * Producer entry point. Records an event in the caller's transaction, next to the domain change
 * it describes.
 */
@Singleton
public class DomainEvents {
    private final EventLog log;
    private final ClaimNotifier notifier;

    public DomainEvents(EventLog log, @Nullable ClaimNotifier notifier) {
        this.log = log;
        this.notifier = notifier;
    }

    /**
     * @param payload JSON text, or any object Jackson can serialize
     */
    public Event record(String objectType, String eventType, Object payload) {
        String json = payload instanceof String s ? s : Jsons.toJson(payload);
        Event event = log.append(objectType, eventType, json);
        if (notifier != null) {
            notifier.registerAfterCommit(event.id());
        }
        return event;
    }
}
