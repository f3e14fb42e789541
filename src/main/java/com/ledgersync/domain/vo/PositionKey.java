package com.ledgersync.domain.vo;

import lombok.Value;

/**
 * Identifies at most one open position: (symbol, exchange, currency).
 * An empty exchange means the primary/unspecified venue; null is normalized to empty.
 */
@Value
public class PositionKey {

    String symbol;
    String exchange;
    String currency;

    public PositionKey(String symbol, String exchange, String currency) {
        this.symbol = symbol;
        this.exchange = exchange != null ? exchange : "";
        this.currency = currency;
    }

    public static PositionKey of(String symbol, String exchange, String currency) {
        return new PositionKey(symbol, exchange, currency);
    }

    /** True when this key refers to the same instrument regardless of the exchange label. */
    public boolean sameInstrument(String symbol, String currency) {
        return this.symbol.equals(symbol) && this.currency.equals(currency);
    }
}
