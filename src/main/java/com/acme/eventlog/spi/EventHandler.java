package com.acme.eventlog.spi;

/**
 * Downstream processing callback. Throwing signals failure. Cursor-mode handlers see
 * at-least-once delivery and must be idempotent.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(EventLog.Event event) throws Exception;
}
