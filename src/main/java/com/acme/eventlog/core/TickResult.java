package com.acme.eventlog.core;

/**
 * Outcome of one consumer tick. Counts only cover events whose checkpoint was written.
 *
 * @param checkpoint checkpoint after the tick, or -1 when the consumer row could not be read
 * @param truncated  events removed by the watermark step
 */
public record TickResult(Status status, int processed, int skipped, long checkpoint, long truncated) {

    public enum Status { IDLE, PROCESSED, FAILED }

    public static TickResult idle(long checkpoint) {
        return new TickResult(Status.IDLE, 0, 0, checkpoint, 0);
    }

    public static TickResult failed(int processed, int skipped, long checkpoint, long truncated) {
        return new TickResult(Status.FAILED, processed, skipped, checkpoint, truncated);
    }

    /**
     * True when the tick moved the checkpoint.
     */
    public boolean productive() {
        return processed + skipped > 0;
    }
}
