package com.ledgersync.cache;

import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.domain.model.AccountPnL;
import com.ledgersync.domain.model.AccountSummary;
import com.ledgersync.domain.model.DailyPnLPoint;
import com.ledgersync.domain.model.HistoryEntry;
import com.ledgersync.domain.model.LedgerSnapshot;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.TradeRecord;
import com.ledgersync.domain.vo.PositionKey;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process mirror of the ledger and account state. All external reads are served from
 * here; durable storage is only read once, to hydrate.
 *
 * <p>Holds the open positions (indexed by key, id and venue contract id), closed-position
 * history, account valuation fields, the daily PnL series and the per-execution realized
 * values used to make repeated commission reports idempotent.
 *
 * <p>Every public method is one short critical section on a single lock and never performs
 * I/O. Snapshot methods return copies, so callers can hold them without seeing later
 * mutations.
 *
 * <p>Write-back: account summary fields and the staged daily PnL payload are tracked as
 * dirty. The flusher takes them with {@link #collectDirty()}, persists them outside the
 * lock, then calls {@link #clearDirty(FlushPayload)}. A field written again between the two
 * calls stays dirty.
 */
@Component
public class LedgerCache {

    private static final Logger log = LoggerFactory.getLogger(LedgerCache.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private boolean initialized;
    private Long accountId;
    private String baseCurrency;
    private Instant lastUpdate;
    private BigDecimal realizedTotal = BigDecimal.ZERO;

    private final Map<PositionKey, Position> positionsByKey = new HashMap<>();
    private final Map<Long, PositionKey> keysById = new HashMap<>();
    private final Map<Long, PositionKey> keysByContract = new HashMap<>();
    private final Map<Long, HistoryEntry> historyById = new HashMap<>();

    private final Map<AccountSummaryField, BigDecimal> accountSummary = new EnumMap<>(AccountSummaryField.class);
    private Instant accountSummaryAsOf;
    private final Map<AccountSummaryField, Long> dirtySummaryVersions = new EnumMap<>(AccountSummaryField.class);
    private long summaryVersion;

    private final TreeMap<LocalDate, BigDecimal> dailyPnlByDate = new TreeMap<>();
    private List<DailyPnLPoint> dailySeries = List.of();
    private LocalDate currentTradeDate;
    private DailyPnLPoint pendingDailyPayload;

    private final Map<String, ExecRealized> execRealizedById = new HashMap<>();

    public LedgerCache(Clock clock) {
        this.clock = clock;
    }

    // ===== Lifecycle =====

    public boolean isInitialized() {
        return locked(() -> initialized);
    }

    /** First writer wins: later calls keep the account identity already set. */
    public void setAccount(long accountId, String baseCurrency) {
        locked(() -> {
            if (this.accountId == null) {
                this.accountId = accountId;
            }
            if (this.baseCurrency == null) {
                this.baseCurrency = baseCurrency;
            }
        });
    }

    /** Replaces all cached state with the snapshot and marks the cache ready. */
    public void hydrate(LedgerSnapshot snapshot) {
        locked(() -> {
            accountId = snapshot.getAccountId();
            baseCurrency = snapshot.getBaseCurrency();
            realizedTotal = orZero(snapshot.getRealizedTotal());

            positionsByKey.clear();
            keysById.clear();
            keysByContract.clear();
            historyById.clear();
            execRealizedById.clear();

            for (Position source : snapshot.getPositions()) {
                Position position = source.toBuilder().build();
                position.recomputeTotal();
                PositionKey key = position.positionKey();
                positionsByKey.put(key, position);
                if (position.getId() != null) {
                    keysById.put(position.getId(), key);
                }
                if (position.getContractId() != null) {
                    keysByContract.put(position.getContractId(), key);
                }
            }
            for (HistoryEntry entry : snapshot.getHistory()) {
                historyById.put(entry.getId(), entry.toBuilder().build());
            }

            accountSummary.clear();
            if (snapshot.getAccountSummary() != null) {
                accountSummary.putAll(snapshot.getAccountSummary());
            }
            accountSummaryAsOf = snapshot.getAccountSummaryAsOf();
            dirtySummaryVersions.clear();

            dailyPnlByDate.clear();
            if (snapshot.getDailyPnl() != null) {
                dailyPnlByDate.putAll(snapshot.getDailyPnl());
            }
            rebuildDailySeries();
            currentTradeDate = dailyPnlByDate.isEmpty() ? null : dailyPnlByDate.lastKey();

            if (snapshot.getBookedTrades() != null) {
                for (TradeRecord trade : snapshot.getBookedTrades()) {
                    if (trade.getExecId() != null) {
                        execRealizedById.put(
                                trade.getExecId(),
                                new ExecRealized(
                                        PositionKey.of(trade.getSymbol(), trade.getExchange(), trade.getCurrency()),
                                        orZero(trade.getRealizedPnl())));
                    }
                }
            }
            pendingDailyPayload = null;

            initialized = true;
            log.info(
                    "Ledger cache hydrated: accountId={}, positions={}, history={}, dailyPoints={}, executions={}",
                    accountId,
                    positionsByKey.size(),
                    historyById.size(),
                    dailyPnlByDate.size(),
                    execRealizedById.size());
        });
    }

    /** Hydrates only if nothing has hydrated or written the cache yet. */
    public boolean hydrateIfUninitialized(LedgerSnapshot snapshot) {
        return locked(() -> {
            if (initialized) {
                return false;
            }
            hydrate(snapshot);
            return true;
        });
    }

    public void markUpdated() {
        locked(this::touch);
    }

    public Long getAccountId() {
        return locked(() -> accountId);
    }

    public String getBaseCurrency() {
        return locked(() -> baseCurrency);
    }

    public Instant getLastUpdate() {
        return locked(() -> lastUpdate);
    }

    // ===== Positions =====

    /**
     * Creates or replaces the open position for the update's key. Unrealized, daily and
     * realized PnL of an existing position are carried over untouched.
     */
    public Position upsertPosition(PositionUpdate update) {
        return locked(() -> {
            PositionKey key = update.getKey();
            Position existing = positionsByKey.get(key);

            Long id = update.getId() != null ? update.getId() : existing != null ? existing.getId() : null;
            Long contractId = update.getContractId() != null
                    ? update.getContractId()
                    : existing != null ? existing.getContractId() : null;
            Instant openTime = update.getOpenTime() != null
                    ? update.getOpenTime()
                    : existing != null ? existing.getOpenTime() : null;

            Position position = Position.builder()
                    .id(id)
                    .symbol(key.getSymbol())
                    .exchange(key.getExchange())
                    .currency(key.getCurrency())
                    .quantity(update.getQuantity())
                    .avgCost(update.getAvgCost())
                    .totalCost(update.getTotalCost())
                    .realizedPnl(existing != null ? existing.getRealizedPnl() : BigDecimal.ZERO)
                    .unrealizedPnl(existing != null ? existing.getUnrealizedPnl() : BigDecimal.ZERO)
                    .dailyPnl(existing != null ? existing.getDailyPnl() : BigDecimal.ZERO)
                    .openTime(openTime)
                    .contractId(contractId)
                    .build();
            position.recomputeTotal();

            if (existing != null) {
                unindex(existing);
            }
            positionsByKey.put(key, position);
            if (id != null) {
                keysById.put(id, key);
            }
            if (contractId != null) {
                keysByContract.put(contractId, key);
            }
            touch();
            return position.toBuilder().build();
        });
    }

    /** Drops the open position for {@code key}. History is not affected. */
    public Optional<Position> removePosition(PositionKey key) {
        return locked(() -> {
            Position removed = positionsByKey.remove(key);
            if (removed != null) {
                unindex(removed);
            }
            touch();
            return Optional.ofNullable(removed).map(p -> p.toBuilder().build());
        });
    }

    public Optional<Position> getPosition(PositionKey key) {
        return locked(() -> Optional.ofNullable(positionsByKey.get(key)).map(p -> p.toBuilder().build()));
    }

    /** Open positions for an instrument across all exchange labels. */
    public List<Position> findPositions(String symbol, String currency) {
        return locked(() -> positionsByKey.values().stream()
                .filter(p -> p.positionKey().sameInstrument(symbol, currency))
                .map(p -> p.toBuilder().build())
                .toList());
    }

    /** Moves the open time of every open position for the instrument to {@code openTime}. */
    public void updateOpenTime(String symbol, String currency, Instant openTime) {
        locked(() -> {
            for (Position position : positionsByKey.values()) {
                if (position.positionKey().sameInstrument(symbol, currency)) {
                    position.setOpenTime(openTime);
                }
            }
            touch();
        });
    }

    /**
     * Applies a live valuation to the position subscribed under {@code contractId}. A null
     * {@code dailyPnl} leaves the daily value as it was.
     *
     * @return false if no open position is subscribed under that contract id
     */
    public boolean updatePositionValuationByContract(long contractId, BigDecimal unrealizedPnl, BigDecimal dailyPnl) {
        return locked(() -> {
            PositionKey key = keysByContract.get(contractId);
            Position position = key != null ? positionsByKey.get(key) : null;
            if (position == null) {
                return false;
            }
            position.setUnrealizedPnl(unrealizedPnl);
            if (dailyPnl != null) {
                position.setDailyPnl(dailyPnl);
            }
            position.recomputeTotal();
            touch();
            return true;
        });
    }

    // ===== Realized PnL =====

    /** Adds {@code delta} to the open position's realized PnL. No-op if it is not open. */
    public void applyRealizedDelta(PositionKey key, BigDecimal delta) {
        locked(() -> applyDelta(key, delta));
    }

    /**
     * Records the latest realized value reported for an execution and applies only the
     * difference to the last value seen for it, to both the account realized total and the
     * position. Repeated delivery of the same value changes nothing.
     *
     * @return the delta that was applied
     */
    public BigDecimal recordExecRealized(String execId, PositionKey key, BigDecimal realizedValue) {
        return locked(() -> {
            ExecRealized previous = execRealizedById.get(execId);
            BigDecimal delta = previous != null ? realizedValue.subtract(previous.value()) : realizedValue;
            execRealizedById.put(execId, new ExecRealized(key, realizedValue));
            if (delta.signum() != 0) {
                realizedTotal = realizedTotal.add(delta);
                applyDelta(key, delta);
            }
            return delta;
        });
    }

    /**
     * Like {@link #recordExecRealized} for an execution whose position is already closed:
     * only the account realized total moves, never an open position under the same key.
     *
     * @return the delta that was applied
     */
    public BigDecimal recordClosedExecRealized(String execId, PositionKey key, BigDecimal realizedValue) {
        return locked(() -> {
            ExecRealized previous = execRealizedById.get(execId);
            BigDecimal delta = previous != null ? realizedValue.subtract(previous.value()) : realizedValue;
            execRealizedById.put(execId, new ExecRealized(key, realizedValue));
            if (delta.signum() != 0) {
                realizedTotal = realizedTotal.add(delta);
                touch();
            }
            return delta;
        });
    }

    public Optional<BigDecimal> getPositionRealized(PositionKey key) {
        return locked(() -> Optional.ofNullable(positionsByKey.get(key)).map(Position::getRealizedPnl));
    }

    // ===== History =====

    public void addHistory(HistoryEntry entry) {
        locked(() -> {
            historyById.put(entry.getId(), entry.toBuilder().build());
            touch();
        });
    }

    /** Amends a closed position's window. No-op if the id is unknown. */
    public void updateHistoryRealized(long id, Instant openTime, Instant closeTime, BigDecimal realizedPnl) {
        locked(() -> {
            HistoryEntry entry = historyById.get(id);
            if (entry == null) {
                return;
            }
            entry.setOpenTime(openTime);
            entry.setCloseTime(closeTime);
            entry.setRealizedPnl(realizedPnl);
            touch();
        });
    }

    // ===== Account valuation =====

    /**
     * Sets one trading date's daily PnL and rebuilds the cumulative series. When the
     * current trading date changes, the previous date's final point is staged for flush.
     */
    public void updateDailyPnL(LocalDate tradeDate, BigDecimal dailyPnl) {
        locked(() -> {
            LocalDate previousDate = currentTradeDate;
            dailyPnlByDate.put(tradeDate, dailyPnl);
            rebuildDailySeries();
            if (previousDate != null && !previousDate.equals(tradeDate)) {
                findDailyPoint(previousDate).ifPresent(point -> {
                    pendingDailyPayload = point;
                    log.info("Trading date rolled {} -> {}, staged final daily PnL", previousDate, tradeDate);
                });
            }
            currentTradeDate = tradeDate;
            touch();
        });
    }

    public void updateAccountSummaryField(AccountSummaryField field, BigDecimal value) {
        locked(() -> {
            accountSummary.put(field, value);
            accountSummaryAsOf = clock.instant();
            dirtySummaryVersions.put(field, ++summaryVersion);
            touch();
        });
    }

    // ===== Write-back =====

    public FlushPayload collectDirty() {
        return locked(() -> {
            Map<AccountSummaryField, BigDecimal> values = new EnumMap<>(AccountSummaryField.class);
            for (AccountSummaryField field : dirtySummaryVersions.keySet()) {
                values.put(field, accountSummary.get(field));
            }
            Map<AccountSummaryField, Long> versions = dirtySummaryVersions.isEmpty()
                    ? Map.of()
                    : new EnumMap<>(dirtySummaryVersions);
            return new FlushPayload(
                    Collections.unmodifiableMap(values), Collections.unmodifiableMap(versions), pendingDailyPayload);
        });
    }

    /** Clears exactly what {@code flushed} carried, unless it was written again since. */
    public void clearDirty(FlushPayload flushed) {
        locked(() -> {
            flushed.getSummaryVersions()
                    .forEach((field, version) -> dirtySummaryVersions.remove(field, version));
            if (flushed.getDailyPayload() != null && flushed.getDailyPayload().equals(pendingDailyPayload)) {
                pendingDailyPayload = null;
            }
        });
    }

    // ===== Snapshots =====

    public List<Position> snapshotPositions() {
        return locked(() -> positionsByKey.values().stream()
                .sorted(Comparator.comparing(Position::getSymbol).thenComparing(Position::getExchange))
                .map(p -> p.toBuilder().build())
                .toList());
    }

    public List<HistoryEntry> snapshotHistory() {
        return locked(() -> historyById.values().stream()
                .sorted(Comparator.comparing(
                                HistoryEntry::getCloseTime, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                        .reversed())
                .map(h -> h.toBuilder().build())
                .toList());
    }

    public AccountPnL snapshotAccountPnL() {
        return locked(() -> {
            BigDecimal unrealized = positionsByKey.values().stream()
                    .map(Position::getUnrealizedPnl)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal daily = dailyPnlByDate.isEmpty() ? BigDecimal.ZERO : dailyPnlByDate.lastEntry().getValue();
            return AccountPnL.builder()
                    .accountId(accountId)
                    .baseCurrency(baseCurrency)
                    .realizedPnl(realizedTotal)
                    .unrealizedPnl(unrealized)
                    .dailyPnl(daily)
                    .totalPnl(realizedTotal.add(unrealized))
                    .asOf(lastUpdate != null ? lastUpdate : clock.instant())
                    .build();
        });
    }

    public AccountSummary snapshotAccountSummary() {
        return locked(() -> AccountSummary.builder()
                .accountId(accountId)
                .baseCurrency(baseCurrency)
                .values(Collections.unmodifiableMap(new EnumMap<>(accountSummaryOrEmpty())))
                .asOf(accountSummaryAsOf != null ? accountSummaryAsOf : clock.instant())
                .build());
    }

    public List<DailyPnLPoint> snapshotDailyPnL() {
        return locked(() -> dailySeries);
    }

    // ===== Internals (lock held) =====

    private Map<AccountSummaryField, BigDecimal> accountSummaryOrEmpty() {
        return accountSummary.isEmpty() ? new EnumMap<>(AccountSummaryField.class) : accountSummary;
    }

    private void applyDelta(PositionKey key, BigDecimal delta) {
        Position position = positionsByKey.get(key);
        if (position == null) {
            return;
        }
        position.setRealizedPnl(position.getRealizedPnl().add(delta));
        position.recomputeTotal();
        touch();
    }

    private void unindex(Position position) {
        if (position.getId() != null) {
            keysById.remove(position.getId());
        }
        if (position.getContractId() != null) {
            keysByContract.remove(position.getContractId());
        }
    }

    private void rebuildDailySeries() {
        List<DailyPnLPoint> series = new ArrayList<>(dailyPnlByDate.size());
        BigDecimal cumulative = BigDecimal.ZERO;
        for (Map.Entry<LocalDate, BigDecimal> entry : dailyPnlByDate.entrySet()) {
            cumulative = cumulative.add(entry.getValue());
            series.add(DailyPnLPoint.builder()
                    .tradeDate(entry.getKey())
                    .dailyPnl(entry.getValue())
                    .cumulativePnl(cumulative)
                    .build());
        }
        dailySeries = List.copyOf(series);
    }

    private Optional<DailyPnLPoint> findDailyPoint(LocalDate date) {
        return dailySeries.stream().filter(p -> p.getTradeDate().equals(date)).findFirst();
    }

    private void touch() {
        lastUpdate = clock.instant();
        initialized = true;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void locked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    private record ExecRealized(PositionKey key, BigDecimal value) {}
}
