package com.acme.eventlog.core;

/**
 * A handler failed on an event. The event stays in the log and is retried on a later tick.
 */
public class ProcessingException extends EventLogException {
    private final long eventId;

    public ProcessingException(long eventId, Throwable cause) {
        super("Processing failed for event " + eventId + ": " + cause.getMessage(), cause);
        this.eventId = eventId;
    }

    public long getEventId() {
        return eventId;
    }
}
