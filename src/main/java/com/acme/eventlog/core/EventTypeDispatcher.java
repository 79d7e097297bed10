package com.acme.eventlog.core;

import com.acme.eventlog.spi.EventHandler;
import com.acme.eventlog.spi.EventLog.Event;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Routes each event to the handler registered for its event type. The routing table is fixed
 * at build time. Event types without a handler go to the fallback, which rejects them unless one
 * is configured.
 */
public final class EventTypeDispatcher implements EventHandler {
    private final Map<String, EventHandler> handlers;
    private final EventHandler fallback;

    private EventTypeDispatcher(Map<String, EventHandler> handlers, EventHandler fallback) {
        this.handlers = Map.copyOf(handlers);
        this.fallback = fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void handle(Event event) throws Exception {
        handlers.getOrDefault(event.eventType(), fallback).handle(event);
    }

    public static final class Builder {
        private final Map<String, EventHandler> handlers = new HashMap<>();
        private EventHandler fallback = event -> {
            throw new IllegalArgumentException("No handler for event type " + event.eventType());
        };

        private Builder() {
        }

        public Builder on(String eventType, EventHandler handler) {
            if (handlers.putIfAbsent(eventType, Objects.requireNonNull(handler)) != null) {
                throw new IllegalStateException("Handler already registered for " + eventType);
            }
            return this;
        }

        public Builder otherwise(EventHandler handler) {
            this.fallback = Objects.requireNonNull(handler);
            return this;
        }

        public EventTypeDispatcher build() {
            return new EventTypeDispatcher(handlers, fallback);
        }
    }
}
