package com.ledgersync.domain.model;

import lombok.Builder;
import lombok.Value;

/** A tradable instrument as the venue identifies it. contractId is set once qualified. */
@Value
@Builder(toBuilder = true)
public class Instrument {

    String symbol;
    String exchange;
    String currency;
    Long contractId;
}
