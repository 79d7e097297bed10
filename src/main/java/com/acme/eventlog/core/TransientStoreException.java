package com.acme.eventlog.core;

/**
 * Connection or lock-wait failure talking to the store. The current tick is abandoned and the
 * next one retries.
 */
public class TransientStoreException extends EventLogException {
    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
