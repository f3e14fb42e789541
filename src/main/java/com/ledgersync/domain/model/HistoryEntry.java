package com.ledgersync.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * A closed position. The id is the id the position had while open, so history rows stay
 * addressable by the same identifier. Only the close time and realized total change after
 * archiving, and only when a late execution or commission report widens the window.
 */
@Data
@Builder(toBuilder = true)
public class HistoryEntry {

    private Long id;
    private String symbol;
    private String exchange;
    private String currency;
    private Instant openTime;
    private Instant closeTime;
    private BigDecimal realizedPnl;
}
