package com.ledgersync.domain.model;

import com.ledgersync.domain.enums.AccountSummaryField;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Everything the ledger cache needs to hydrate from durable storage in one go. */
@Value
@Builder(toBuilder = true)
public class LedgerSnapshot {

    long accountId;
    String baseCurrency;
    BigDecimal realizedTotal;
    List<Position> positions;
    List<HistoryEntry> history;
    Map<AccountSummaryField, BigDecimal> accountSummary;
    Instant accountSummaryAsOf;
    Map<LocalDate, BigDecimal> dailyPnl;

    /**
     * Stored trade rows with an exec id, carrying the realized value already booked for
     * each execution. Replayed reports for these apply only their difference.
     */
    List<TradeRecord> bookedTrades;
}
