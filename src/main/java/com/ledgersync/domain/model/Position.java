package com.ledgersync.domain.model;

import com.ledgersync.domain.vo.PositionKey;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * An open position as held by the ledger cache.
 *
 * <p>Quantity is signed (negative = short). {@code totalCost} is the signed cost basis
 * including opening commissions, so {@code avgCost = totalCost / quantity}.
 * {@code totalPnl} always equals {@code realizedPnl + unrealizedPnl}; callers that change
 * either input go through {@link #recomputeTotal()}.
 *
 * <p>{@code contractId} is the venue's contract identifier. It only correlates live
 * valuation updates with this position and is null until the venue reports the position.
 */
@Data
@Builder(toBuilder = true)
public class Position {

    private Long id;
    private String symbol;
    private String exchange;
    private String currency;

    private BigDecimal quantity;
    private BigDecimal avgCost;
    private BigDecimal totalCost;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal dailyPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal totalPnl = BigDecimal.ZERO;

    private Instant openTime;
    private Long contractId;

    public PositionKey positionKey() {
        return PositionKey.of(symbol, exchange, currency);
    }

    public void recomputeTotal() {
        this.totalPnl = realizedPnl.add(unrealizedPnl);
    }
}
