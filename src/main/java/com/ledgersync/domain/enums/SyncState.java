package com.ledgersync.domain.enums;

/** Lifecycle of the venue sync worker. */
public enum SyncState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    STOPPED
}
