package com.ledgersync.venue.event;

import lombok.Builder;
import lombok.Value;

/** The venue's view of one position. Zero quantity means the position is closed. */
@Value
@Builder
public class PositionSnapshotEvent {

    String account;
    Long contractId;
    String symbol;
    String exchange;
    String currency;
    Double quantity;
    Double avgCost;
}
