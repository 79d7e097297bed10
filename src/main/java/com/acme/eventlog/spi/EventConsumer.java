package com.acme.eventlog.spi;

import java.util.Set;

/**
 * A named cursor-mode consumer. Every bean of this type gets its own scheduled run loop.
 */
public interface EventConsumer extends EventHandler {

    String name();

    /**
     * Event types this consumer wants. Anything else is skipped for good.
     */
    default Set<String> topics() {
        return Set.of(ConsumerCheckpointStore.WILDCARD);
    }
}
