package com.ledgersync.venue.event;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountPnLEvent {

    String account;
    Double dailyPnl;
    Double unrealizedPnl;
    Double realizedPnl;
}
