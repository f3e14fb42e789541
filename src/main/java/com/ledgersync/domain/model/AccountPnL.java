package com.ledgersync.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Account-wide PnL view. Realized is the running total of per-execution realized values,
 * unrealized is summed over open positions, daily is the latest trading date's value.
 */
@Value
@Builder
public class AccountPnL {

    Long accountId;
    String baseCurrency;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    BigDecimal dailyPnl;
    BigDecimal totalPnl;
    Instant asOf;
}
