package com.ledgersync.ledger;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One trade-log row produced by applying a trade. A flip yields a closing leg on the
 * archived position and an opening leg on the new one.
 */
@Value
@Builder
public class TradeLeg {

    /** Unsigned quantity of this leg. */
    BigDecimal quantity;

    BigDecimal commission;
    BigDecimal realizedPnl;

    /** True for the leg that belongs to the newly opened position of a flip. */
    boolean opening;
}
