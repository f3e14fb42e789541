package com.ledgersync.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/** Live valuation of one venue contract. dailyPnl is null when the venue did not send it. */
@Value
public class PositionValuation {

    BigDecimal unrealizedPnl;
    BigDecimal dailyPnl;
}
