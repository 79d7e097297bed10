package com.acme.eventlog.claim;

public enum ClaimOutcome {
    /** Claimed, handled and deleted. */
    PROCESSED,
    /** Locked by another worker or already gone. Expected for duplicate hints. */
    NOT_CLAIMED
}
