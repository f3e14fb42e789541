package com.ledgersync.persistence;

import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.domain.model.Account;
import com.ledgersync.domain.model.DailyPnLPoint;
import com.ledgersync.domain.model.HistoryEntry;
import com.ledgersync.domain.model.LedgerSnapshot;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.PositionValuation;
import com.ledgersync.domain.model.TradeRecord;
import com.ledgersync.domain.vo.PositionKey;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for the ledger: the append-only trade log, open positions, closed-position
 * history, account summary fields and final daily PnL rows.
 *
 * <p>Instrument-level queries match on symbol and currency and ignore the exchange label.
 * Every method may throw {@link com.ledgersync.exception.StorageException} or a Spring
 * {@code DataAccessException}; the sync session treats both as fatal for the session.
 */
public interface LedgerStore {

    /** Creates the account row if missing and returns its id. */
    long upsertAccount(String externalAccount, String baseCurrency);

    /** The first stored account, used to warm the cache before the venue is reachable. */
    Optional<Account> findDefaultAccount();

    /** Everything the cache needs to start serving reads for the account. */
    LedgerSnapshot loadSnapshot(long accountId, String baseCurrency);

    /**
     * Appends a trade row.
     *
     * @return false if a row with the same exec id already exists; nothing is written then
     */
    boolean appendTrade(TradeRecord trade);

    /** True if the execution is stored, either as one row or as the closing leg of a flip. */
    boolean hasTrade(String execId);

    Optional<TradeRecord> findTradeByExecId(String execId);

    void updateTradeReport(long tradeId, BigDecimal commission, BigDecimal realizedPnl);

    /** Sum of realized PnL over trades in {@code [from, to]}. A null {@code from} is unbounded. */
    BigDecimal sumRealized(long accountId, String symbol, String currency, Instant from, Instant to);

    /** Earliest trade time strictly after {@code after}, or the earliest overall if it is null. */
    Optional<Instant> findFirstTradeTime(long accountId, String symbol, String currency, Instant after);

    Optional<Instant> findLastTradeTime(long accountId, String symbol, String currency);

    Optional<Instant> findLastCloseTime(long accountId, String symbol, String currency);

    /**
     * Inserts or updates the open position for the position's key. On update, quantity and
     * cost basis are replaced, the contract id is replaced when given, and an existing open
     * time and PnL values are kept.
     *
     * @return the stored position, with its id
     */
    Position saveOpenPosition(long accountId, Position position);

    void updatePositionRealized(long accountId, PositionKey key, BigDecimal realizedPnl);

    void updatePositionOpenTime(long positionId, Instant openTime);

    /**
     * Moves an open position to history in one transaction: the history row takes the
     * position's id, the open row is deleted.
     */
    HistoryEntry archivePosition(long accountId, Position position, Instant closeTime, BigDecimal realizedPnl);

    /** The most recently closed position for the instrument. */
    Optional<HistoryEntry> findLatestHistory(long accountId, String symbol, String currency);

    Optional<HistoryEntry> findHistory(long historyId);

    /** Replaces the window and realized PnL of a closed position. */
    void updateHistory(long historyId, Instant openTime, Instant closeTime, BigDecimal realizedPnl);

    /** Batch valuation write, keyed by venue contract id. A null daily value is left as stored. */
    void updatePositionValuations(long accountId, Map<Long, PositionValuation> valuations);

    /** Writes only the given fields; other stored fields keep their values. */
    void upsertAccountSummary(long accountId, Map<AccountSummaryField, BigDecimal> values);

    void upsertDailyPnL(long accountId, DailyPnLPoint point);
}
