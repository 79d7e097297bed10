package com.acme.eventlog.spi;

/**
 * Handler invoked by the exclusive claim worker while it holds the lock on the event.
 */
public interface ClaimedEventHandler extends EventHandler {
}
