package com.ledgersync.domain.model;

import com.ledgersync.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * One row of the append-only trade log.
 *
 * <p>A flip produces two rows from one venue execution, with exec ids
 * {@code <execId>-close} and {@code <execId>-open}. Commission and realized PnL may be
 * back-filled once by a late commission report; nothing else changes after insert.
 */
@Data
@Builder(toBuilder = true)
public class TradeRecord {

    public static final String CLOSE_LEG_SUFFIX = "-close";
    public static final String OPEN_LEG_SUFFIX = "-open";

    private Long id;
    private Long accountId;
    private Long positionId;
    private String symbol;
    private String exchange;
    private String currency;
    private OrderSide side;

    /** Unsigned quantity of this row. */
    private BigDecimal quantity;

    private BigDecimal price;
    private BigDecimal commission;

    /** Realized PnL attributed to this row. Zero for opening trades. */
    private BigDecimal realizedPnl;

    private Instant tradeTime;
    private String execId;
    private Long permId;
}
