package com.ledgersync.domain.enums;

/**
 * Result of an order submission as seen by the caller. PENDING means the request is still
 * queued on the sync worker when the caller's wait ran out; it has not been abandoned.
 */
public enum OrderOutcome {
    SUCCESS,
    PENDING,
    FAILURE
}
