package com.ledgersync.oms;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Order payload as submitted by the serving layer, before validation.
 *
 * <p>Side and type are the caller's strings: side accepts BUY/SELL (or the venue's BOT/SLD),
 * type accepts MKT/MARKET or LMT/LIMIT. Exchange and currency default to SMART and the
 * account's base currency.
 */
@Data
@Builder
public class OrderRequest {

    private String symbol;

    /** Unsigned quantity; must be positive. */
    private BigDecimal quantity;

    private String side;

    @Builder.Default
    private String orderType = "MKT";

    /** Limit price. Required for limit orders. */
    private BigDecimal price;

    private String exchange;
    private String currency;

    /** Venue time-in-force code, passed through as given. */
    private String timeInForce;

    /** Venue account to book the order to; the session's account when null. */
    private String account;
}
