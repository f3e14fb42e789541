package com.ledgersync.domain.enums;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/** Buy or sell side of an order or execution. */
public enum OrderSide {
    BUY,
    SELL;

    /**
     * Normalizes the side labels venues report. Executions arrive as {@code BOT}/{@code SLD},
     * order payloads as {@code buy}/{@code sell} in either case.
     */
    public static Optional<OrderSide> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "BOT", "BUY" -> Optional.of(BUY);
            case "SLD", "SELL" -> Optional.of(SELL);
            default -> Optional.empty();
        };
    }

    /** Applies the side's sign to an unsigned quantity: BUY positive, SELL negative. */
    public BigDecimal sign(BigDecimal quantity) {
        return this == BUY ? quantity.abs() : quantity.abs().negate();
    }
}
