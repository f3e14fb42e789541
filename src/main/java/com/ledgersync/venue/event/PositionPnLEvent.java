package com.ledgersync.venue.event;

import lombok.Builder;
import lombok.Value;

/** Live valuation of one subscribed contract. dailyPnl may be absent. */
@Value
@Builder
public class PositionPnLEvent {

    Long contractId;
    Double dailyPnl;
    Double unrealizedPnl;
}
