package com.acme.eventlog.spi;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only, truncatable log of domain events.
 *
 * <p>Two read modes share the log: cursor scans ({@link #scanSince}) used by named consumers,
 * and exclusive claims ({@link #claimOne(long)}, {@link #claimOne()}) used by competing workers.
 * Claims hold a row lock until the surrounding transaction ends and never wait for one.
 */
public interface EventLog {

    /**
     * Appends an event inside the caller's transaction. The row becomes visible to scans once
     * that transaction commits.
     *
     * @throws IllegalStateException if no transaction is active
     */
    Event append(String objectType, String eventType, String payload);

    /**
     * Events with {@code id > checkpoint}, ascending by id, at most {@code limit} of them.
     */
    List<Event> scanSince(long checkpoint, int limit);

    /**
     * Locks exactly the given row. Returns empty if the row is gone or another transaction
     * already holds it. Must be called inside a transaction.
     */
    Optional<Event> claimOne(long targetId);

    /**
     * Locks the lowest-id row not locked by anyone else. Returns empty if every row is locked
     * or the log is empty. Must be called inside a transaction.
     */
    Optional<Event> claimOne();

    /**
     * Deletes every event with {@code id <= watermark}.
     *
     * @return number of events removed
     */
    long deleteUpTo(long watermark);

    /**
     * Deletes a single event. Called inside the transaction holding the claim on it.
     */
    boolean deleteOne(long id);

    record Event(
        long id,
        String objectType,
        String eventType,
        String payload,
        Instant createdAt
    ) {}
}
