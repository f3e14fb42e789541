package com.ledgersync.sync;

import com.ledgersync.cache.LedgerCache;
import com.ledgersync.cache.PositionUpdate;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.domain.enums.OrderSide;
import com.ledgersync.domain.model.HistoryEntry;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.PositionValuation;
import com.ledgersync.domain.model.TradeRecord;
import com.ledgersync.domain.vo.PositionKey;
import com.ledgersync.exception.InvalidTradeException;
import com.ledgersync.exception.VenueException;
import com.ledgersync.ledger.CostBasisEngine;
import com.ledgersync.ledger.LedgerResult;
import com.ledgersync.ledger.LedgerTrade;
import com.ledgersync.ledger.PositionState;
import com.ledgersync.ledger.TradeLeg;
import com.ledgersync.observability.SyncMetrics;
import com.ledgersync.persistence.LedgerStore;
import com.ledgersync.venue.VenueEventListener;
import com.ledgersync.venue.VenueGateway;
import com.ledgersync.venue.VenueNumbers;
import com.ledgersync.venue.event.AccountPnLEvent;
import com.ledgersync.venue.event.AccountValueEvent;
import com.ledgersync.venue.event.CommissionReportEvent;
import com.ledgersync.venue.event.ConnectivityEvent;
import com.ledgersync.venue.event.ExecutionEvent;
import com.ledgersync.venue.event.PositionPnLEvent;
import com.ledgersync.venue.event.PositionSnapshotEvent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps venue events onto the ledger, the cache and durable storage for the current session.
 *
 * <p>Execution pipeline:
 * <ol>
 *   <li>Scope and parse: foreign accounts and malformed payloads are dropped</li>
 *   <li>Exchange resolution against the open positions of the instrument</li>
 *   <li>Duplicate check on the exec id (a flip is stored as its two legs)</li>
 *   <li>Cost basis via {@link CostBasisEngine}, then trade rows, open position and history
 *       writes for the resulting action</li>
 *   <li>Commission reports that arrived before the trade row are applied</li>
 *   <li>Open time is moved back if the execution predates it</li>
 *   <li>A late execution for a closed instrument widens the history window</li>
 * </ol>
 *
 * <p>An execution that arrives after its instrument was archived, and is timed at or before
 * that close, is booked against the history entry. It never opens a position.
 *
 * <p>Called only from the sync worker thread. Storage failures propagate and end the session;
 * bad venue data never does.
 */
@Component
public class VenueEventHandler implements VenueEventListener {

    private static final Logger log = LoggerFactory.getLogger(VenueEventHandler.class);

    private static final int COMMISSION_SCALE = 10;

    private final LedgerCache ledgerCache;
    private final LedgerStore ledgerStore;
    private final VenueGateway venueGateway;
    private final CostBasisEngine costBasisEngine;
    private final SyncProperties syncProperties;
    private final TradingCalendar tradingCalendar;
    private final SyncStatusTracker syncStatusTracker;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    private SyncSession session;

    public VenueEventHandler(
            LedgerCache ledgerCache,
            LedgerStore ledgerStore,
            VenueGateway venueGateway,
            CostBasisEngine costBasisEngine,
            SyncProperties syncProperties,
            TradingCalendar tradingCalendar,
            SyncStatusTracker syncStatusTracker,
            SyncMetrics syncMetrics,
            Clock clock) {
        this.ledgerCache = ledgerCache;
        this.ledgerStore = ledgerStore;
        this.venueGateway = venueGateway;
        this.costBasisEngine = costBasisEngine;
        this.syncProperties = syncProperties;
        this.tradingCalendar = tradingCalendar;
        this.syncStatusTracker = syncStatusTracker;
        this.syncMetrics = syncMetrics;
        this.clock = clock;
    }

    public void openSession(SyncSession session) {
        this.session = session;
    }

    public void closeSession() {
        this.session = null;
    }

    public SyncSession getSession() {
        return session;
    }

    // ===== Replay =====

    /**
     * Replays what the venue reports on connect: recent executions first, then the full
     * position list, so positions end at the venue's numbers. Open positions the venue no
     * longer reports are archived.
     */
    public void replay() {
        SyncSession current = requireSession();
        List<ExecutionEvent> executions = venueGateway.requestExecutions();
        for (ExecutionEvent execution : executions) {
            onExecution(execution);
        }
        log.info("Replayed {} executions", executions.size());

        List<PositionSnapshotEvent> snapshot = venueGateway.requestPositions(current.getAccountCode());
        reconcilePositions(snapshot);
    }

    /** Applies a full position refresh and archives every open position missing from it. */
    public void reconcilePositions(List<PositionSnapshotEvent> snapshot) {
        SyncSession current = requireSession();
        Set<PositionKey> seen = new HashSet<>();
        for (PositionSnapshotEvent event : snapshot) {
            if (!current.isOwnAccount(event.getAccount())) {
                continue;
            }
            onPositionSnapshot(event);
            seen.add(PositionKey.of(event.getSymbol(), event.getExchange(), event.getCurrency()));
        }
        int archived = 0;
        for (Position position : ledgerCache.snapshotPositions()) {
            if (!seen.contains(position.positionKey())) {
                archiveFromVenue(position);
                archived++;
            }
        }
        log.info("Reconciled {} venue positions, archived {} no longer reported", seen.size(), archived);
    }

    // ===== Executions =====

    @Override
    public void onExecution(ExecutionEvent event) {
        long start = System.nanoTime();
        SyncSession current = requireSession();
        if (!current.isOwnAccount(event.getAccount())) {
            drop("execution", "foreign account " + event.getAccount());
            return;
        }
        Optional<OrderSide> side = OrderSide.parse(event.getSide());
        Optional<BigDecimal> quantity = VenueNumbers.toDecimal(event.getQuantity());
        Optional<BigDecimal> price = VenueNumbers.toDecimal(event.getPrice());
        if (event.getExecId() == null
                || event.getSymbol() == null
                || side.isEmpty()
                || quantity.isEmpty()
                || quantity.get().signum() <= 0
                || price.isEmpty()
                || price.get().signum() <= 0) {
            drop("execution", "malformed execution " + event.getExecId());
            return;
        }

        String execId = event.getExecId();
        String symbol = event.getSymbol();
        String currency = event.getCurrency();
        String exchange = resolveExchange(symbol, currency, event.getExchange());
        PositionKey key = PositionKey.of(symbol, exchange, currency);
        Instant tradeTime = event.getTime() != null ? event.getTime() : clock.instant();

        CommissionReportEvent embedded = event.getCommissionReport();
        if (ledgerStore.hasTrade(execId)) {
            log.debug("Execution {} already stored", execId);
            if (embedded != null) {
                onCommissionReport(embedded);
            }
            return;
        }

        BigDecimal commission = embedded != null
                ? VenueNumbers.toDecimal(embedded.getCommission()).orElse(BigDecimal.ZERO)
                : BigDecimal.ZERO;
        LedgerTrade trade = LedgerTrade.builder()
                .side(side.get())
                .quantity(quantity.get())
                .price(price.get())
                .commission(commission)
                .build();

        TradeRecord row = TradeRecord.builder()
                .accountId(current.getAccountId())
                .symbol(symbol)
                .exchange(exchange)
                .currency(currency)
                .side(side.get())
                .price(price.get())
                .tradeTime(tradeTime)
                .execId(execId)
                .permId(event.getPermId())
                .build();

        Optional<HistoryEntry> closedWindow = findClosedWindow(symbol, currency, tradeTime);
        if (closedWindow.isPresent()) {
            bookLate(closedWindow.get(), key, row, quantity.get(), commission);
            current.takePendingReport(execId).ifPresent(this::onCommissionReport);
            if (embedded != null) {
                onCommissionReport(embedded);
            }
            syncMetrics.eventProcessed("execution");
            touched();
            log.info(
                    "Late execution {} {} {}@{} booked against closed position id={}",
                    execId,
                    symbol,
                    quantity.get(),
                    price.get(),
                    closedWindow.get().getId());
            return;
        }

        Optional<Position> existing = ledgerCache.getPosition(key);
        LedgerResult result;
        try {
            result = costBasisEngine.apply(existing.map(PositionState::of).orElse(PositionState.FLAT), trade);
        } catch (InvalidTradeException e) {
            drop("execution", e.getMessage());
            return;
        }

        switch (result.getAction()) {
            case OPEN -> bookOpen(key, result.getPosition(), row, result.getLegs().get(0), event.getContractId());
            case ADD, PARTIAL_CLOSE -> bookAdjust(key, existing.get(), result, row, event.getContractId());
            case FULL_CLOSE -> bookFullClose(key, existing.get(), result, row);
            case FLIP -> bookFlip(key, existing.get(), result, row, event.getContractId());
        }

        current.takePendingReport(execId).ifPresent(this::onCommissionReport);
        backdateOpenTime(symbol, currency, tradeTime);
        widenHistory(symbol, currency, tradeTime, result.getRealizedPnl());
        if (embedded != null) {
            onCommissionReport(embedded);
        }

        syncMetrics.eventProcessed("execution");
        touched();
        log.debug(
                "onExecution {} {} {} {}@{} -> {} in {}ms",
                execId,
                symbol,
                side.get(),
                quantity.get(),
                price.get(),
                result.getAction(),
                elapsedMillis(start));
    }

    /** The latest closed window of a flat instrument, if the trade time falls at or before its close. */
    private Optional<HistoryEntry> findClosedWindow(String symbol, String currency, Instant tradeTime) {
        if (!ledgerCache.findPositions(symbol, currency).isEmpty()) {
            return Optional.empty();
        }
        return ledgerStore.findLatestHistory(session.getAccountId(), symbol, currency)
                .filter(entry -> entry.getCloseTime() != null && !tradeTime.isAfter(entry.getCloseTime()));
    }

    private void bookLate(
            HistoryEntry entry, PositionKey key, TradeRecord row, BigDecimal quantity, BigDecimal commission) {
        boolean stored = ledgerStore.appendTrade(row.toBuilder()
                .positionId(entry.getId())
                .quantity(quantity)
                .commission(commission)
                .realizedPnl(BigDecimal.ZERO)
                .build());
        if (!stored) {
            log.debug("Trade {} was already stored", row.getExecId());
        }
        ledgerCache.recordClosedExecRealized(row.getExecId(), key, BigDecimal.ZERO);
        resumHistory(entry, row.getTradeTime());
    }

    private void bookOpen(PositionKey key, PositionState opened, TradeRecord row, TradeLeg leg, Long contractId) {
        Position saved = saveOpen(key, opened, row.getTradeTime(), contractId);
        appendLeg(row, saved.getId(), leg, row.getExecId());
        ledgerCache.recordExecRealized(row.getExecId(), key, BigDecimal.ZERO);
        subscribe(contractId != null ? contractId : saved.getContractId());
    }

    private void bookAdjust(PositionKey key, Position existing, LedgerResult result, TradeRecord row, Long contractId) {
        PositionState state = result.getPosition();
        appendLeg(row, existing.getId(), result.getLegs().get(0), row.getExecId());
        Position saved = ledgerStore.saveOpenPosition(
                session.getAccountId(),
                existing.toBuilder()
                        .quantity(state.getQuantity())
                        .avgCost(state.getAvgCost())
                        .totalCost(state.getTotalCost())
                        .contractId(contractId != null ? contractId : existing.getContractId())
                        .build());
        ledgerCache.upsertPosition(PositionUpdate.builder()
                .id(saved.getId())
                .key(key)
                .quantity(state.getQuantity())
                .avgCost(state.getAvgCost())
                .totalCost(state.getTotalCost())
                .contractId(saved.getContractId())
                .build());
        recordRealized(row.getExecId(), key, result.getRealizedPnl());
    }

    private void bookFullClose(PositionKey key, Position existing, LedgerResult result, TradeRecord row) {
        appendLeg(row, existing.getId(), result.getLegs().get(0), row.getExecId());
        recordRealized(row.getExecId(), key, result.getRealizedPnl());
        archive(ledgerCache.getPosition(key).orElse(existing), row.getTradeTime());
    }

    private void bookFlip(PositionKey key, Position existing, LedgerResult result, TradeRecord row, Long contractId) {
        TradeLeg closing = result.getLegs().get(0);
        TradeLeg opening = result.getLegs().get(1);
        String closeExecId = row.getExecId() + TradeRecord.CLOSE_LEG_SUFFIX;
        String openExecId = row.getExecId() + TradeRecord.OPEN_LEG_SUFFIX;

        appendLeg(row, existing.getId(), closing, closeExecId);
        recordRealized(closeExecId, key, closing.getRealizedPnl());
        archive(ledgerCache.getPosition(key).orElse(existing), row.getTradeTime());

        Long newContractId = contractId != null ? contractId : existing.getContractId();
        Position saved = saveOpen(key, result.getOpenedPosition(), row.getTradeTime(), newContractId);
        appendLeg(row, saved.getId(), opening, openExecId);
        subscribe(newContractId);
        log.info(
                "Position flipped: {} closed {} realized={}, opened {}",
                key,
                closing.getQuantity(),
                closing.getRealizedPnl(),
                result.getOpenedPosition().getQuantity());
    }

    private Position saveOpen(PositionKey key, PositionState state, Instant openTime, Long contractId) {
        Position saved = ledgerStore.saveOpenPosition(
                session.getAccountId(),
                Position.builder()
                        .symbol(key.getSymbol())
                        .exchange(key.getExchange())
                        .currency(key.getCurrency())
                        .quantity(state.getQuantity())
                        .avgCost(state.getAvgCost())
                        .totalCost(state.getTotalCost())
                        .openTime(openTime)
                        .contractId(contractId)
                        .build());
        ledgerCache.upsertPosition(PositionUpdate.builder()
                .id(saved.getId())
                .key(key)
                .quantity(state.getQuantity())
                .avgCost(state.getAvgCost())
                .totalCost(state.getTotalCost())
                .openTime(saved.getOpenTime())
                .contractId(saved.getContractId())
                .build());
        return saved;
    }

    private void appendLeg(TradeRecord row, Long positionId, TradeLeg leg, String execId) {
        boolean stored = ledgerStore.appendTrade(row.toBuilder()
                .positionId(positionId)
                .execId(execId)
                .quantity(leg.getQuantity())
                .commission(leg.getCommission())
                .realizedPnl(leg.getRealizedPnl())
                .build());
        if (!stored) {
            log.debug("Trade {} was already stored", execId);
        }
    }

    /** Resolves which exchange label an execution is booked under. */
    String resolveExchange(String symbol, String currency, String reported) {
        String exchange = reported != null ? reported : "";
        List<String> openExchanges = ledgerCache.findPositions(symbol, currency).stream()
                .map(Position::getExchange)
                .sorted(Comparator.naturalOrder())
                .toList();
        if (openExchanges.isEmpty() || openExchanges.contains(exchange)) {
            return exchange;
        }
        return openExchanges.stream()
                .filter(candidate -> !candidate.isEmpty())
                .filter(candidate -> !syncProperties.getAlternativeExchanges().contains(candidate))
                .findFirst()
                .orElse(openExchanges.get(0));
    }

    // ===== Commission reports =====

    @Override
    public void onCommissionReport(CommissionReportEvent event) {
        SyncSession current = requireSession();
        if (event.getExecId() == null) {
            drop("commission", "missing exec id");
            return;
        }
        Optional<BigDecimal> commission = VenueNumbers.toDecimal(event.getCommission());
        if (commission.isEmpty()) {
            drop("commission", "invalid commission for " + event.getExecId());
            return;
        }
        BigDecimal realized = VenueNumbers.toDecimal(event.getRealizedPnl()).orElse(BigDecimal.ZERO);
        String execId = event.getExecId();

        Optional<TradeRecord> trade = ledgerStore.findTradeByExecId(execId);
        if (trade.isPresent()) {
            TradeRecord row = trade.get();
            ledgerStore.updateTradeReport(row.getId(), commission.get(), realized);
            applyReportedRealized(execId, row, realized);
        } else {
            Optional<TradeRecord> closeLeg = ledgerStore.findTradeByExecId(execId + TradeRecord.CLOSE_LEG_SUFFIX);
            if (closeLeg.isEmpty()) {
                current.bufferReport(event);
                log.debug("Commission report for {} buffered until its trade arrives", execId);
                return;
            }
            applyFlipReport(execId, closeLeg.get(), commission.get(), realized);
        }
        syncMetrics.eventProcessed("commission");
        touched();
    }

    private void applyFlipReport(String execId, TradeRecord closeLeg, BigDecimal commission, BigDecimal realized) {
        Optional<TradeRecord> openLeg = ledgerStore.findTradeByExecId(execId + TradeRecord.OPEN_LEG_SUFFIX);
        BigDecimal closeQty = closeLeg.getQuantity();
        BigDecimal totalQty = closeQty.add(openLeg.map(TradeRecord::getQuantity).orElse(BigDecimal.ZERO));
        BigDecimal closeCommission = totalQty.signum() == 0
                ? commission
                : commission.multiply(closeQty).divide(totalQty, COMMISSION_SCALE, RoundingMode.HALF_EVEN);

        ledgerStore.updateTradeReport(closeLeg.getId(), closeCommission, realized);
        openLeg.ifPresent(leg ->
                ledgerStore.updateTradeReport(leg.getId(), commission.subtract(closeCommission), BigDecimal.ZERO));
        applyReportedRealized(closeLeg.getExecId(), closeLeg, realized);
    }

    /**
     * Books a reported realized value. If the row belongs to a position that is no longer open,
     * only the account total moves and that position's history entry is resummed.
     */
    private void applyReportedRealized(String execId, TradeRecord row, BigDecimal realized) {
        PositionKey key = PositionKey.of(row.getSymbol(), row.getExchange(), row.getCurrency());
        Long positionId = row.getPositionId();
        boolean stillOpen = positionId == null
                || ledgerCache.getPosition(key).map(Position::getId).filter(positionId::equals).isPresent();
        if (stillOpen) {
            recordRealized(execId, key, realized);
            widenHistory(row.getSymbol(), row.getCurrency(), row.getTradeTime(), realized);
            return;
        }
        ledgerCache.recordClosedExecRealized(execId, key, realized);
        Optional<HistoryEntry> closed = ledgerStore.findHistory(positionId);
        if (closed.isPresent()) {
            resumHistory(closed.get(), row.getTradeTime());
        } else {
            widenHistory(row.getSymbol(), row.getCurrency(), row.getTradeTime(), realized);
        }
    }

    /** Records an execution's realized value in the cache and writes the position total through. */
    private void recordRealized(String execId, PositionKey key, BigDecimal realized) {
        BigDecimal delta = ledgerCache.recordExecRealized(execId, key, realized);
        if (delta.signum() == 0) {
            return;
        }
        ledgerCache.getPositionRealized(key).ifPresent(total ->
                ledgerStore.updatePositionRealized(session.getAccountId(), key, total));
    }

    // ===== Positions =====

    @Override
    public void onPositionSnapshot(PositionSnapshotEvent event) {
        long start = System.nanoTime();
        SyncSession current = requireSession();
        if (!current.isOwnAccount(event.getAccount())) {
            drop("position", "foreign account " + event.getAccount());
            return;
        }
        Optional<BigDecimal> quantity = VenueNumbers.toDecimal(event.getQuantity());
        if (event.getSymbol() == null || quantity.isEmpty()) {
            drop("position", "malformed position " + event.getSymbol());
            return;
        }
        PositionKey key = PositionKey.of(event.getSymbol(), event.getExchange(), event.getCurrency());
        Optional<Position> existing = ledgerCache.getPosition(key);

        if (quantity.get().signum() == 0) {
            existing.ifPresent(this::archiveFromVenue);
            syncMetrics.eventProcessed("position");
            touched();
            return;
        }

        BigDecimal avgCost = VenueNumbers.toDecimal(event.getAvgCost()).orElse(BigDecimal.ZERO);
        BigDecimal totalCost = quantity.get().multiply(avgCost);
        Instant openTime = existing.map(Position::getOpenTime)
                .orElseGet(() -> recoverOpenTime(key.getSymbol(), key.getCurrency()));

        Position saved = ledgerStore.saveOpenPosition(
                current.getAccountId(),
                Position.builder()
                        .symbol(key.getSymbol())
                        .exchange(key.getExchange())
                        .currency(key.getCurrency())
                        .quantity(quantity.get())
                        .avgCost(avgCost)
                        .totalCost(totalCost)
                        .openTime(openTime)
                        .contractId(event.getContractId())
                        .build());
        ledgerCache.upsertPosition(PositionUpdate.builder()
                .id(saved.getId())
                .key(key)
                .quantity(quantity.get())
                .avgCost(avgCost)
                .totalCost(totalCost)
                .openTime(saved.getOpenTime())
                .contractId(saved.getContractId())
                .build());
        subscribe(saved.getContractId());

        syncMetrics.eventProcessed("position");
        touched();
        log.debug("onPositionSnapshot {} qty={} in {}ms", key, quantity.get(), elapsedMillis(start));
    }

    /** First trade after the instrument was last closed, else now. */
    private Instant recoverOpenTime(String symbol, String currency) {
        long accountId = session.getAccountId();
        Instant lastClose = ledgerStore.findLastCloseTime(accountId, symbol, currency).orElse(null);
        return ledgerStore.findFirstTradeTime(accountId, symbol, currency, lastClose).orElseGet(clock::instant);
    }

    /** Archives a position the venue reports flat or no longer reports. */
    private void archiveFromVenue(Position position) {
        Instant closeTime = ledgerStore
                .findLastTradeTime(session.getAccountId(), position.getSymbol(), position.getCurrency())
                .orElseGet(clock::instant);
        archive(position, closeTime);
    }

    /**
     * Moves a position to history. Realized PnL of the history entry is the sum over the
     * instrument's trades inside the open window.
     */
    private void archive(Position position, Instant closeTime) {
        long accountId = session.getAccountId();
        Instant openTime = position.getOpenTime();
        Instant from = openTime == null || openTime.isAfter(closeTime) ? closeTime : openTime;
        BigDecimal realized =
                ledgerStore.sumRealized(accountId, position.getSymbol(), position.getCurrency(), from, closeTime);

        HistoryEntry entry = ledgerStore.archivePosition(accountId, position, closeTime, realized);
        ledgerCache.addHistory(entry);
        ledgerCache.removePosition(position.positionKey());
        unsubscribe(position.getContractId());
    }

    private void backdateOpenTime(String symbol, String currency, Instant tradeTime) {
        for (Position position : ledgerCache.findPositions(symbol, currency)) {
            if (position.getOpenTime() != null && tradeTime.isBefore(position.getOpenTime())) {
                if (position.getId() != null) {
                    ledgerStore.updatePositionOpenTime(position.getId(), tradeTime);
                }
                ledgerCache.updateOpenTime(symbol, currency, tradeTime);
                log.debug("Open time of {} moved back to {}", position.positionKey(), tradeTime);
            }
        }
    }

    /**
     * A realized amount booked for an instrument with no open position belongs to its last
     * closed window: extend the window to cover the trade and resum realized over it.
     */
    private void widenHistory(String symbol, String currency, Instant tradeTime, BigDecimal realized) {
        if (realized == null || realized.signum() == 0 || tradeTime == null) {
            return;
        }
        if (!ledgerCache.findPositions(symbol, currency).isEmpty()) {
            return;
        }
        long accountId = session.getAccountId();
        Optional<HistoryEntry> latest = ledgerStore.findLatestHistory(accountId, symbol, currency);
        if (latest.isEmpty()) {
            return;
        }
        resumHistory(latest.get(), tradeTime);
    }

    /** Stretches a history window over {@code tradeTime} and resums realized PnL inside it. */
    private void resumHistory(HistoryEntry entry, Instant tradeTime) {
        Instant closeTime = entry.getCloseTime() == null || tradeTime.isAfter(entry.getCloseTime())
                ? tradeTime
                : entry.getCloseTime();
        Instant openTime = entry.getOpenTime() == null || tradeTime.isBefore(entry.getOpenTime())
                ? tradeTime
                : entry.getOpenTime();
        BigDecimal total = ledgerStore.sumRealized(
                session.getAccountId(), entry.getSymbol(), entry.getCurrency(), openTime, closeTime);
        ledgerStore.updateHistory(entry.getId(), openTime, closeTime, total);
        ledgerCache.updateHistoryRealized(entry.getId(), openTime, closeTime, total);
        log.debug("History id={} window {}..{} realized={}", entry.getId(), openTime, closeTime, total);
    }

    // ===== Valuations =====

    @Override
    public void onPositionPnL(PositionPnLEvent event) {
        SyncSession current = requireSession();
        Optional<BigDecimal> unrealized = VenueNumbers.toDecimal(event.getUnrealizedPnl());
        if (event.getContractId() == null || unrealized.isEmpty()) {
            drop("position_pnl", "malformed valuation for contract " + event.getContractId());
            return;
        }
        BigDecimal daily = VenueNumbers.toDecimal(event.getDailyPnl()).orElse(null);
        PositionValuation valuation = new PositionValuation(unrealized.get(), daily);
        if (!current.getValuationBuffer().offer(event.getContractId(), valuation)) {
            return;
        }
        ledgerCache.updatePositionValuationByContract(event.getContractId(), unrealized.get(), daily);
        syncMetrics.eventProcessed("position_pnl");
        touched();
    }

    @Override
    public void onAccountPnL(AccountPnLEvent event) {
        SyncSession current = requireSession();
        if (!current.isOwnAccount(event.getAccount())) {
            drop("account_pnl", "foreign account " + event.getAccount());
            return;
        }
        Optional<BigDecimal> realized = VenueNumbers.toDecimal(event.getRealizedPnl());
        Optional<BigDecimal> unrealized = VenueNumbers.toDecimal(event.getUnrealizedPnl());
        if (realized.isEmpty() || unrealized.isEmpty()) {
            drop("account_pnl", "invalid values");
            return;
        }
        BigDecimal daily = VenueNumbers.toDecimal(event.getDailyPnl()).orElse(BigDecimal.ZERO);
        ledgerCache.updateDailyPnL(tradingCalendar.today(), daily);
        syncMetrics.eventProcessed("account_pnl");
        touched();
        log.debug("onAccountPnL daily={} unrealized={} realized={}", daily, unrealized.get(), realized.get());
    }

    @Override
    public void onAccountValue(AccountValueEvent event) {
        SyncSession current = requireSession();
        if (!current.isOwnAccount(event.getAccount())) {
            drop("account_value", "foreign account " + event.getAccount());
            return;
        }
        String currency = event.getCurrency();
        if (currency != null
                && !currency.isEmpty()
                && !"BASE".equals(currency)
                && !currency.equals(current.getBaseCurrency())) {
            drop("account_value", "currency " + currency);
            return;
        }
        Optional<AccountSummaryField> field = AccountSummaryField.fromVenueTag(event.getTag());
        if (field.isEmpty()) {
            log.trace("Ignoring account value tag {}", event.getTag());
            return;
        }
        Optional<BigDecimal> value = VenueNumbers.parse(event.getValue());
        if (value.isEmpty()) {
            drop("account_value", "invalid value for " + event.getTag());
            return;
        }
        ledgerCache.updateAccountSummaryField(field.get(), value.get());
        syncMetrics.eventProcessed("account_value");
        touched();
    }

    @Override
    public void onConnectivity(ConnectivityEvent event) {
        if (syncProperties.getDegradedCodes().contains(event.getCode())) {
            log.warn("Venue session degraded: code={} {}", event.getCode(), event.getMessage());
            syncStatusTracker.markVenueDegraded();
        } else if (syncProperties.getRestoredCodes().contains(event.getCode())) {
            log.info("Venue session restored: code={} {}", event.getCode(), event.getMessage());
            syncStatusTracker.markVenueRestored();
        } else {
            log.debug("Venue notice code={} {}", event.getCode(), event.getMessage());
        }
    }

    // ===== Subscriptions =====

    private void subscribe(Long contractId) {
        if (contractId == null || !session.addSubscription(contractId)) {
            return;
        }
        try {
            venueGateway.subscribePositionPnL(session.getAccountCode(), contractId);
        } catch (VenueException e) {
            session.removeSubscription(contractId);
            log.warn("Failed to subscribe valuations for contract {}: {}", contractId, e.getMessage());
        }
    }

    private void unsubscribe(Long contractId) {
        if (contractId == null || !session.removeSubscription(contractId)) {
            return;
        }
        try {
            venueGateway.unsubscribePositionPnL(contractId);
        } catch (VenueException e) {
            log.warn("Failed to unsubscribe valuations for contract {}: {}", contractId, e.getMessage());
        }
    }

    // ===== Helpers =====

    private SyncSession requireSession() {
        if (session == null) {
            throw new IllegalStateException("No open sync session");
        }
        return session;
    }

    private void drop(String kind, String reason) {
        syncMetrics.eventDropped(kind);
        log.debug("Dropped {} event: {}", kind, reason);
    }

    private void touched() {
        syncStatusTracker.markUpdated(ledgerCache.getLastUpdate());
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
