package com.ledgersync.venue.event;

import lombok.Builder;
import lombok.Value;

/** Commission and realized PnL the venue reports for an execution, possibly late or twice. */
@Value
@Builder
public class CommissionReportEvent {

    String execId;
    Double commission;
    Double realizedPnl;
}
