package com.ledgersync.venue.simulator;

import com.ledgersync.config.VenueConfig;
import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.domain.enums.OrderSide;
import com.ledgersync.domain.enums.OrderType;
import com.ledgersync.domain.model.Instrument;
import com.ledgersync.exception.ErrorCode;
import com.ledgersync.exception.VenueException;
import com.ledgersync.ledger.CostBasisEngine;
import com.ledgersync.ledger.LedgerResult;
import com.ledgersync.ledger.LedgerTrade;
import com.ledgersync.ledger.PositionState;
import com.ledgersync.venue.VenueEventListener;
import com.ledgersync.venue.VenueGateway;
import com.ledgersync.venue.VenueOrder;
import com.ledgersync.venue.VenueOrderStatus;
import com.ledgersync.venue.event.AccountPnLEvent;
import com.ledgersync.venue.event.AccountValueEvent;
import com.ledgersync.venue.event.CommissionReportEvent;
import com.ledgersync.venue.event.ExecutionEvent;
import com.ledgersync.venue.event.PositionPnLEvent;
import com.ledgersync.venue.event.PositionSnapshotEvent;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paper venue that fills every order immediately and reports it through the same event
 * stream a real venue would: execution, commission report, position snapshot and, for
 * subscribed contracts, live valuations.
 *
 * <p>Fills happen at the limit price for LIMIT orders and at the symbol's mark for MARKET
 * orders. Marks default to the configured price and can be moved with
 * {@link #setMarkPrice}. Venue-side positions are kept with the same average-cost rules as
 * the ledger, via {@link CostBasisEngine}.
 */
public class SimulatedVenueGateway implements VenueGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedVenueGateway.class);

    private static final String EXCHANGE = "SMART";

    private final VenueConfig.Simulator settings;
    private final CostBasisEngine costBasisEngine;
    private final Clock clock;

    private final Queue<Consumer<VenueEventListener>> pending = new ConcurrentLinkedQueue<>();
    private final Map<String, SimPosition> positions = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> marks = new ConcurrentHashMap<>();
    private final Map<String, Long> contractIds = new ConcurrentHashMap<>();
    private final Map<String, VenueOrderStatus> orders = new ConcurrentHashMap<>();
    private final List<ExecutionEvent> executions = new CopyOnWriteArrayList<>();
    private final Set<Long> pnlSubscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong(1000);

    private volatile boolean connected;
    private volatile boolean accountPnLSubscribed;
    private volatile boolean accountSummarySubscribed;
    private BigDecimal cash;
    private BigDecimal realizedTotal = BigDecimal.ZERO;

    public SimulatedVenueGateway(VenueConfig.Simulator settings, CostBasisEngine costBasisEngine, Clock clock) {
        this.settings = settings;
        this.costBasisEngine = costBasisEngine;
        this.clock = clock;
        this.cash = settings.getStartingCash();
    }

    @Override
    public void connect() {
        connected = true;
        log.info("Simulated venue connected: account={}", settings.getAccount());
    }

    @Override
    public void disconnect() {
        connected = false;
        pnlSubscriptions.clear();
        accountPnLSubscribed = false;
        accountSummarySubscribed = false;
        pending.clear();
        log.info("Simulated venue disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public List<String> getManagedAccounts() {
        return List.of(settings.getAccount());
    }

    @Override
    public List<PositionSnapshotEvent> requestPositions(String account) {
        ensureConnected();
        return positions.values().stream().map(this::snapshotOf).toList();
    }

    @Override
    public List<ExecutionEvent> requestExecutions() {
        ensureConnected();
        return List.copyOf(executions);
    }

    @Override
    public void subscribeAccountPnL(String account) {
        ensureConnected();
        accountPnLSubscribed = true;
    }

    @Override
    public void subscribeAccountSummary(String account, Collection<String> tags) {
        ensureConnected();
        accountSummarySubscribed = true;
    }

    @Override
    public void subscribePositionPnL(String account, long contractId) {
        ensureConnected();
        pnlSubscriptions.add(contractId);
    }

    @Override
    public void unsubscribePositionPnL(long contractId) {
        pnlSubscriptions.remove(contractId);
    }

    @Override
    public Optional<Instrument> qualifyInstrument(Instrument instrument) {
        ensureConnected();
        if (instrument.getSymbol() == null || instrument.getSymbol().isBlank()) {
            return Optional.empty();
        }
        String symbol = instrument.getSymbol().trim().toUpperCase(Locale.ROOT);
        return Optional.of(instrument.toBuilder()
                .symbol(symbol)
                .exchange(instrument.getExchange() != null ? instrument.getExchange() : EXCHANGE)
                .currency(instrument.getCurrency() != null ? instrument.getCurrency() : settings.getCurrency())
                .contractId(contractIdFor(symbol))
                .build());
    }

    @Override
    public synchronized String placeOrder(Instrument instrument, VenueOrder order) {
        ensureConnected();
        String orderId = String.valueOf(sequence.incrementAndGet());
        BigDecimal price = order.getType() == OrderType.LIMIT ? order.getLimitPrice() : markOf(instrument.getSymbol());
        BigDecimal commission = settings.getCommissionPerShare()
                .multiply(order.getQuantity())
                .max(settings.getMinCommission());

        SimPosition position = positions.computeIfAbsent(
                instrument.getSymbol(), s -> new SimPosition(instrument, PositionState.FLAT));
        LedgerResult result = costBasisEngine.apply(
                position.state,
                LedgerTrade.builder()
                        .side(order.getSide())
                        .quantity(order.getQuantity())
                        .price(price)
                        .commission(commission)
                        .build());
        position.state = result.getAction().archives()
                ? (result.getOpenedPosition() != null ? result.getOpenedPosition() : PositionState.FLAT)
                : result.getPosition();
        cash = cash.subtract(order.getSide().sign(order.getQuantity()).multiply(price)).subtract(commission);
        realizedTotal = realizedTotal.add(result.getRealizedPnl());

        String execId = "SIM." + orderId + ".1";
        ExecutionEvent execution = ExecutionEvent.builder()
                .account(settings.getAccount())
                .execId(execId)
                .permId(sequence.incrementAndGet())
                .contractId(instrument.getContractId())
                .symbol(instrument.getSymbol())
                .exchange(instrument.getExchange())
                .currency(instrument.getCurrency())
                .side(order.getSide() == OrderSide.BUY ? "BOT" : "SLD")
                .quantity(order.getQuantity().doubleValue())
                .price(price.doubleValue())
                .time(clock.instant())
                .build();
        CommissionReportEvent report = CommissionReportEvent.builder()
                .execId(execId)
                .commission(commission.doubleValue())
                .realizedPnl(result.getRealizedPnl().doubleValue())
                .build();
        executions.add(execution.toBuilder().commissionReport(report).build());

        PositionSnapshotEvent snapshot = snapshotOf(position);
        pending.add(listener -> listener.onExecution(execution));
        pending.add(listener -> listener.onCommissionReport(report));
        pending.add(listener -> listener.onPositionSnapshot(snapshot));
        if (position.state.isFlat()) {
            positions.remove(instrument.getSymbol());
        }

        orders.put(orderId, VenueOrderStatus.builder()
                .orderId(orderId)
                .status("Filled")
                .filled(order.getQuantity())
                .remaining(BigDecimal.ZERO)
                .avgFillPrice(price)
                .build());
        log.info(
                "Simulated fill: orderId={}, symbol={}, side={}, qty={}, price={}",
                orderId,
                instrument.getSymbol(),
                order.getSide(),
                order.getQuantity(),
                price);
        return orderId;
    }

    @Override
    public VenueOrderStatus getOrderStatus(String orderId) {
        VenueOrderStatus status = orders.get(orderId);
        if (status == null) {
            throw new VenueException(ErrorCode.VENUE_ERROR, "Unknown order id " + orderId);
        }
        return status;
    }

    @Override
    public Instant requestCurrentTime() {
        ensureConnected();
        return clock.instant();
    }

    @Override
    public void pumpEvents(VenueEventListener listener, Duration maxWait) throws InterruptedException {
        ensureConnected();
        int delivered = 0;
        Consumer<VenueEventListener> event;
        while ((event = pending.poll()) != null) {
            event.accept(listener);
            delivered++;
        }
        publishValuations(listener);
        if (delivered == 0 && !maxWait.isZero()) {
            Thread.sleep(maxWait.toMillis());
        }
    }

    /** Moves the mark used for market fills and live valuation of {@code symbol}. */
    public void setMarkPrice(String symbol, BigDecimal price) {
        marks.put(symbol.toUpperCase(Locale.ROOT), price);
    }

    private void publishValuations(VenueEventListener listener) {
        BigDecimal unrealizedTotal = BigDecimal.ZERO;
        BigDecimal grossValue = BigDecimal.ZERO;
        for (SimPosition position : new ArrayList<>(positions.values())) {
            BigDecimal mark = markOf(position.instrument.getSymbol());
            BigDecimal unrealized = mark.multiply(position.state.getQuantity()).subtract(position.state.getTotalCost());
            unrealizedTotal = unrealizedTotal.add(unrealized);
            grossValue = grossValue.add(mark.multiply(position.state.getQuantity()).abs());
            if (pnlSubscriptions.contains(position.instrument.getContractId())) {
                listener.onPositionPnL(PositionPnLEvent.builder()
                        .contractId(position.instrument.getContractId())
                        .unrealizedPnl(unrealized.doubleValue())
                        .dailyPnl(unrealized.doubleValue())
                        .build());
            }
        }
        if (accountPnLSubscribed) {
            listener.onAccountPnL(AccountPnLEvent.builder()
                    .account(settings.getAccount())
                    .dailyPnl(realizedTotal.add(unrealizedTotal).doubleValue())
                    .unrealizedPnl(unrealizedTotal.doubleValue())
                    .realizedPnl(realizedTotal.doubleValue())
                    .build());
        }
        if (accountSummarySubscribed) {
            BigDecimal netLiquidation = cash.add(grossValue);
            accountValue(listener, AccountSummaryField.NET_LIQUIDATION, netLiquidation);
            accountValue(listener, AccountSummaryField.TOTAL_CASH_VALUE, cash);
            accountValue(listener, AccountSummaryField.GROSS_POSITION_VALUE, grossValue);
        }
    }

    private void accountValue(VenueEventListener listener, AccountSummaryField field, BigDecimal value) {
        listener.onAccountValue(AccountValueEvent.builder()
                .account(settings.getAccount())
                .tag(field.getVenueTag())
                .value(value.toPlainString())
                .currency(settings.getCurrency())
                .build());
    }

    private PositionSnapshotEvent snapshotOf(SimPosition position) {
        return PositionSnapshotEvent.builder()
                .account(settings.getAccount())
                .contractId(position.instrument.getContractId())
                .symbol(position.instrument.getSymbol())
                .exchange(position.instrument.getExchange())
                .currency(position.instrument.getCurrency())
                .quantity(position.state.getQuantity().doubleValue())
                .avgCost(position.state.getAvgCost().doubleValue())
                .build();
    }

    private BigDecimal markOf(String symbol) {
        return marks.getOrDefault(symbol.toUpperCase(Locale.ROOT), settings.getDefaultPrice());
    }

    private long contractIdFor(String symbol) {
        return contractIds.computeIfAbsent(symbol, s -> sequence.incrementAndGet());
    }

    private void ensureConnected() {
        if (!connected) {
            throw new VenueException(ErrorCode.VENUE_DISCONNECTED, "Simulated venue is not connected");
        }
    }

    private static final class SimPosition {

        private final Instrument instrument;
        private PositionState state;

        private SimPosition(Instrument instrument, PositionState state) {
            this.instrument = instrument;
            this.state = state;
        }
    }
}
