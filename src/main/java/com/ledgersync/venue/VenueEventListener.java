package com.ledgersync.venue;

import com.ledgersync.venue.event.AccountPnLEvent;
import com.ledgersync.venue.event.AccountValueEvent;
import com.ledgersync.venue.event.CommissionReportEvent;
import com.ledgersync.venue.event.ConnectivityEvent;
import com.ledgersync.venue.event.ExecutionEvent;
import com.ledgersync.venue.event.PositionPnLEvent;
import com.ledgersync.venue.event.PositionSnapshotEvent;

/**
 * Receiver of normalized venue events. Implementations are invoked only from the thread
 * that calls {@link VenueGateway#pumpEvents}, never concurrently.
 */
public interface VenueEventListener {

    void onExecution(ExecutionEvent event);

    void onCommissionReport(CommissionReportEvent event);

    void onPositionSnapshot(PositionSnapshotEvent event);

    void onAccountValue(AccountValueEvent event);

    void onAccountPnL(AccountPnLEvent event);

    void onPositionPnL(PositionPnLEvent event);

    void onConnectivity(ConnectivityEvent event);
}
