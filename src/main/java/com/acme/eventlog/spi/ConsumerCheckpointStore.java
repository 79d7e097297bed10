package com.acme.eventlog.spi;

import java.time.Instant;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Durable registry of named consumer cursors.
 */
public interface ConsumerCheckpointStore {

    String WILDCARD = "*";

    /**
     * Creates the consumer with checkpoint 0 and the wildcard topic if absent. An existing row
     * only gets its {@code updatedAt} refreshed.
     */
    Consumer upsert(String name);

    /**
     * Moves the checkpoint forward under the consumer's row lock. A lower value than the stored
     * one leaves the checkpoint unchanged.
     *
     * @return whether a consumer row was affected
     */
    boolean advanceCheckpoint(String name, long newCheckpoint);

    /**
     * Minimum checkpoint across all consumers, or empty when no consumer is registered.
     * Empty means "do not truncate", never zero.
     */
    OptionalLong minCheckpoint();

    /**
     * Replaces the topic set of a consumer. The checkpoint is left alone.
     */
    boolean subscribe(String name, Set<String> topics);

    record Consumer(String name, long checkpoint, Set<String> topics, Instant updatedAt) {

        public Consumer withTopics(Set<String> newTopics) {
            return new Consumer(name, checkpoint, Set.copyOf(newTopics), updatedAt);
        }
    }
}
