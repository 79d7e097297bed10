package com.acme.eventlog.core;

import com.acme.eventlog.spi.ConsumerCheckpointStore;
import java.util.Set;

/**
 * Subscription predicate built from a consumer row. Matching is done on the event type.
 */
public final class TopicFilter {
    private static final TopicFilter ALL = new TopicFilter(true, Set.of());

    private final boolean all;
    private final Set<String> topics;

    private TopicFilter(boolean all, Set<String> topics) {
        this.all = all;
        this.topics = topics;
    }

    public static TopicFilter of(Set<String> topics) {
        if (topics == null || topics.contains(ConsumerCheckpointStore.WILDCARD)) {
            return ALL;
        }
        return new TopicFilter(false, Set.copyOf(topics));
    }

    public boolean matches(String topic) {
        return all || topics.contains(topic);
    }

    @Override
    public String toString() {
        return all ? "TopicFilter[*]" : "TopicFilter" + topics;
    }
}
