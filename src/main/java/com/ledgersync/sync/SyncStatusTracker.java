package com.ledgersync.sync;

import com.ledgersync.domain.enums.SyncState;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Holds the current {@link SyncStatus}. Written by the sync worker, read from any thread.
 * Each transition is one atomic swap of an immutable value.
 */
@Component
public class SyncStatusTracker {

    private final Clock clock;
    private final AtomicReference<SyncStatus> status = new AtomicReference<>(SyncStatus.initial());

    public SyncStatusTracker(Clock clock) {
        this.clock = clock;
    }

    public SyncStatus current() {
        return status.get();
    }

    public void markStarted() {
        update(s -> s.toBuilder().running(true).startedAt(clock.instant()).build());
    }

    public void markConnecting() {
        update(s -> s.toBuilder().state(SyncState.CONNECTING).build());
    }

    public void markConnected() {
        Instant now = clock.instant();
        update(s -> s.toBuilder()
                .state(SyncState.CONNECTED)
                .connected(true)
                .venueReachable(true)
                .error(null)
                .lastConnectedAt(now)
                .venueLastConnectedAt(now)
                .build());
    }

    /** Session ended. {@code error} is kept for display; null means a clean end. */
    public void markDisconnected(String error) {
        Instant now = clock.instant();
        update(s -> s.toBuilder()
                .state(SyncState.DISCONNECTED)
                .connected(false)
                .venueReachable(false)
                .error(error != null ? error : s.getError())
                .lastDisconnectedAt(s.isConnected() ? now : s.getLastDisconnectedAt())
                .venueLastDisconnectedAt(s.isVenueReachable() ? now : s.getVenueLastDisconnectedAt())
                .build());
    }

    public void markStopped() {
        update(s -> s.toBuilder().state(SyncState.STOPPED).running(false).connected(false).build());
    }

    public void markVenueDegraded() {
        update(s -> s.toBuilder().venueReachable(false).venueLastDisconnectedAt(clock.instant()).build());
    }

    public void markVenueRestored() {
        update(s -> s.toBuilder().venueReachable(true).venueLastConnectedAt(clock.instant()).build());
    }

    public void markUpdated(Instant lastUpdate) {
        update(s -> s.toBuilder().lastUpdate(lastUpdate).build());
    }

    private void update(UnaryOperator<SyncStatus> transition) {
        status.updateAndGet(transition);
    }
}
