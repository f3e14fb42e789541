package com.ledgersync.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** One trading date of the account's daily PnL series with its running cumulative. */
@Value
@Builder
public class DailyPnLPoint {

    LocalDate tradeDate;
    BigDecimal dailyPnl;
    BigDecimal cumulativePnl;
}
