package com.ledgersync.venue;

import com.ledgersync.domain.model.Instrument;
import com.ledgersync.venue.event.ExecutionEvent;
import com.ledgersync.venue.event.PositionSnapshotEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Connection to a trading venue. The wire protocol lives behind this interface; callers
 * only see normalized event types.
 *
 * <p>All methods are called from the sync worker thread. Subscribed events are buffered by
 * the implementation and delivered only inside {@link #pumpEvents}, on the caller's thread,
 * so event handling is never concurrent.
 *
 * <p>Every method may throw {@link com.ledgersync.exception.VenueException}.
 */
public interface VenueGateway {

    void connect();

    void disconnect();

    boolean isConnected();

    /** Account codes the venue login can trade. May be empty. */
    List<String> getManagedAccounts();

    /** Full position refresh for the account. */
    List<PositionSnapshotEvent> requestPositions(String account);

    /** Recent executions, with commission reports where the venue already has them. */
    List<ExecutionEvent> requestExecutions();

    /** Subscribes to account-level daily/unrealized/realized PnL. */
    void subscribeAccountPnL(String account);

    /** Subscribes to the named account valuation fields. */
    void subscribeAccountSummary(String account, Collection<String> tags);

    void subscribePositionPnL(String account, long contractId);

    void unsubscribePositionPnL(long contractId);

    /** Resolves the instrument to a tradable contract, or empty if the venue does not know it. */
    Optional<Instrument> qualifyInstrument(Instrument instrument);

    /** Submits an order and returns the venue's order id. */
    String placeOrder(Instrument instrument, VenueOrder order);

    VenueOrderStatus getOrderStatus(String orderId);

    /** Liveness probe. */
    Instant requestCurrentTime();

    /**
     * Delivers buffered events to {@code listener} for up to {@code maxWait}, on the calling
     * thread.
     */
    void pumpEvents(VenueEventListener listener, Duration maxWait) throws InterruptedException;
}
