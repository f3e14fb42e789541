package com.ledgersync.sync;

import com.ledgersync.domain.enums.SyncState;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of the sync worker for the serving layer.
 *
 * <p>{@code connected} is this service's session with the venue gateway;
 * {@code venueReachable} is the gateway's own upstream session, which can drop and recover
 * while the session stays open.
 */
@Value
@Builder(toBuilder = true)
public class SyncStatus {

    boolean running;
    boolean connected;
    boolean venueReachable;
    SyncState state;

    /** Last error that ended a session. Cleared on the next successful connect. */
    String error;

    Instant startedAt;
    Instant lastConnectedAt;
    Instant lastDisconnectedAt;
    Instant venueLastConnectedAt;
    Instant venueLastDisconnectedAt;
    Instant lastUpdate;

    public static SyncStatus initial() {
        return SyncStatus.builder().state(SyncState.DISCONNECTED).build();
    }
}
