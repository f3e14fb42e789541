package com.ledgersync.venue.event;

import lombok.Builder;
import lombok.Value;

/** One named account valuation field. The value arrives as text. */
@Value
@Builder
public class AccountValueEvent {

    String account;
    String tag;
    String value;
    String currency;
}
