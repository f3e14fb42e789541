package com.ledgersync.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Order execution type. LIMIT requires a price. */
public enum OrderType {
    MARKET,
    LIMIT;

    /** Accepts both the short venue codes (MKT, LMT) and the long names. */
    public static Optional<OrderType> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "MKT", "MARKET" -> Optional.of(MARKET);
            case "LMT", "LIMIT" -> Optional.of(LIMIT);
            default -> Optional.empty();
        };
    }
}
