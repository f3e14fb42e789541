package com.ledgersync.ledger;

import com.ledgersync.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of applying one trade to one position.
 *
 * <p>{@code position} is the state of the position the trade was applied to: for
 * FULL_CLOSE and FLIP that is its final state just before archiving (quantity unchanged,
 * realized including this close). {@code openedPosition} is only set for FLIP.
 */
@Value
@Builder
public class LedgerResult {

    TradeAction action;
    PositionState position;
    PositionState openedPosition;

    /** Realized PnL contributed by this trade, net of the closing share of commission. */
    BigDecimal realizedPnl;

    List<TradeLeg> legs;

    public boolean archives() {
        return action.archives();
    }

    public boolean opensNewPosition() {
        return action == TradeAction.OPEN || action == TradeAction.FLIP;
    }
}
