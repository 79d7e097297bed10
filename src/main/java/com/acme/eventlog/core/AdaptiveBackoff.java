package com.acme.eventlog.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;

/**
 * Jittered exponential backoff that gates a fixed-rate ticker.
 *
 * <p>While idle, every tick either is suppressed (the backoff window since the last real attempt
 * has not elapsed yet) or performs a real attempt. A productive attempt resets the backoff so the
 * next tick runs immediately. The window never exceeds 1.5 times the last table entry, which
 * bounds the latency before the next real check.
 *
 * <p>Not thread-safe: each scheduled task owns one instance.
 */
public final class AdaptiveBackoff {
    private final long[] table;
    private final Clock clock;
    private final DoubleSupplier random;

    private int attempts;
    private Instant lastAttemptAt;

    public AdaptiveBackoff(int tableLength, Duration base) {
        this(tableLength, base, Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
    }

    public AdaptiveBackoff(int tableLength, Duration base, Clock clock, DoubleSupplier random) {
        if (tableLength < 1) {
            throw new IllegalArgumentException("tableLength must be >= 1, was " + tableLength);
        }
        if (base.toMillis() < 1) {
            throw new IllegalArgumentException("base must be at least 1ms, was " + base);
        }
        long baseMillis = base.toMillis();
        // the largest entry is baseMillis << (tableLength - 1) and has to stay positive
        if (Long.numberOfLeadingZeros(baseMillis) <= tableLength - 1) {
            throw new IllegalArgumentException(
                "tableLength " + tableLength + " overflows with base " + base);
        }
        this.table = new long[tableLength];
        for (int i = 0; i < tableLength; i++) {
            table[i] = baseMillis << i;
        }
        this.clock = clock;
        this.random = random;
        this.lastAttemptAt = clock.instant();
    }

    /**
     * Decides whether this tick should do real work. A suppressed tick counts as another idle
     * attempt.
     */
    public boolean shouldAttempt() {
        if (attempts == 0) {
            return true;
        }
        long elapsed = Duration.between(lastAttemptAt, clock.instant()).toMillis();
        if (elapsed < window()) {
            increment();
            return false;
        }
        return true;
    }

    /**
     * Records the outcome of an attempted tick.
     */
    public void record(boolean productive) {
        if (productive) {
            attempts = 0;
        } else {
            increment();
        }
        lastAttemptAt = clock.instant();
    }

    /**
     * Runs {@code work} if the backoff allows it and records its outcome. A thrown exception is
     * recorded as an idle attempt and rethrown.
     *
     * @return whether the work ran
     */
    public boolean runIfDue(BooleanSupplier work) {
        if (!shouldAttempt()) {
            return false;
        }
        boolean productive = false;
        try {
            productive = work.getAsBoolean();
        } finally {
            record(productive);
        }
        return true;
    }

    /**
     * Jittered window for the current attempt count: {@code floor(d/2 + random * d)}.
     */
    long window() {
        long d = table[Math.min(attempts, table.length - 1)];
        return (long) Math.floor(d / 2.0 + random.getAsDouble() * d);
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return table.length;
    }

    Duration baseDuration(int index) {
        return Duration.ofMillis(table[index]);
    }

    private void increment() {
        if (attempts < table.length) {
            attempts++;
        }
    }
}
