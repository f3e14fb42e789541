package com.ledgersync.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgersync.cache.LedgerCache;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.config.VenueConfig;
import com.ledgersync.domain.model.HistoryEntry;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.model.TradeRecord;
import com.ledgersync.domain.vo.PositionKey;
import com.ledgersync.ledger.CostBasisEngine;
import com.ledgersync.observability.SyncMetrics;
import com.ledgersync.oms.OrderExecutor;
import com.ledgersync.oms.OrderIdempotencyStore;
import com.ledgersync.oms.OrderJob;
import com.ledgersync.oms.OrderQueue;
import com.ledgersync.oms.OrderRequest;
import com.ledgersync.oms.OrderResult;
import com.ledgersync.oms.OrderSubmissionService;
import com.ledgersync.oms.OrderValidator;
import com.ledgersync.oms.OrderWaiters;
import com.ledgersync.persistence.LedgerStore;
import com.ledgersync.sync.CacheFlusher;
import com.ledgersync.sync.SyncSession;
import com.ledgersync.sync.SyncStatusTracker;
import com.ledgersync.sync.TradingCalendar;
import com.ledgersync.sync.VenueEventHandler;
import com.ledgersync.venue.simulator.SimulatedVenueGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Cross-service integration test for the order-to-ledger flow.
 * Wires the simulated venue, the real submission pipeline, event handler, cost-basis engine
 * and cache by hand over a store mock backed by an in-memory trade log. The test thread
 * plays the sync worker: it drains the queue, executes jobs and pumps venue events.
 */
class OrderFlowIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-03-15T15:00:00Z");
    private static final String ACCOUNT = "SIM-0001";
    private static final long ACCOUNT_ID = 1L;
    private static final PositionKey AAPL = PositionKey.of("AAPL", "SMART", "USD");

    private final Map<String, TradeRecord> trades = new LinkedHashMap<>();
    private final Map<Long, HistoryEntry> history = new LinkedHashMap<>();

    private SimulatedVenueGateway gateway;
    private LedgerCache cache;
    private LedgerStore store;
    private VenueEventHandler handler;
    private OrderQueue queue;
    private OrderExecutor executor;
    private OrderSubmissionService submissionService;
    private CacheFlusher flusher;
    private SyncSession session;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        SyncProperties properties = new SyncProperties();
        properties.setOrderStatusWait(Duration.ZERO);

        VenueConfig.Simulator settings = new VenueConfig.Simulator();
        settings.setAccount(ACCOUNT);
        CostBasisEngine engine = new CostBasisEngine();
        gateway = new SimulatedVenueGateway(settings, engine, clock);

        cache = new LedgerCache(clock);
        cache.setAccount(ACCOUNT_ID, "USD");
        store = inMemoryStore();

        SyncStatusTracker tracker = new SyncStatusTracker(clock);
        queue = new OrderQueue(properties);
        SyncMetrics metrics = new SyncMetrics(new SimpleMeterRegistry(), queue, tracker);

        handler = new VenueEventHandler(
                cache,
                store,
                gateway,
                engine,
                properties,
                new TradingCalendar(clock, properties),
                tracker,
                metrics,
                clock);
        executor = new OrderExecutor(gateway, properties);
        submissionService = new OrderSubmissionService(
                properties,
                new OrderValidator(properties),
                queue,
                new OrderWaiters(),
                new OrderIdempotencyStore(properties),
                tracker,
                metrics,
                clock);
        flusher = new CacheFlusher(cache, store, metrics);

        gateway.connect();
        session = new SyncSession(ACCOUNT, ACCOUNT_ID, "USD");
        handler.openSession(session);
        tracker.markConnected();
    }

    @AfterEach
    void tearDown() {
        handler.closeSession();
        gateway.disconnect();
    }

    /** LedgerStore mock that keeps trades and history in memory so sums and lookups are real. */
    private LedgerStore inMemoryStore() {
        LedgerStore mockStore = mock(LedgerStore.class);
        AtomicLong tradeIds = new AtomicLong();
        AtomicLong positionIds = new AtomicLong();

        when(mockStore.appendTrade(any())).thenAnswer(inv -> {
            TradeRecord row = inv.getArgument(0);
            if (trades.containsKey(row.getExecId())) {
                return false;
            }
            trades.put(row.getExecId(), row.toBuilder().id(tradeIds.incrementAndGet()).build());
            return true;
        });
        when(mockStore.hasTrade(anyString())).thenAnswer(inv -> {
            String execId = inv.getArgument(0);
            return trades.containsKey(execId) || trades.containsKey(execId + TradeRecord.CLOSE_LEG_SUFFIX);
        });
        when(mockStore.findTradeByExecId(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(trades.get(inv.<String>getArgument(0))));
        doAnswer(inv -> {
                    long id = inv.getArgument(0);
                    trades.values().stream()
                            .filter(row -> row.getId() == id)
                            .forEach(row -> {
                                row.setCommission(inv.getArgument(1));
                                row.setRealizedPnl(inv.getArgument(2));
                            });
                    return null;
                })
                .when(mockStore)
                .updateTradeReport(anyLong(), any(), any());
        when(mockStore.sumRealized(anyLong(), anyString(), anyString(), any(), any()))
                .thenAnswer(inv -> trades.values().stream()
                        .filter(row -> row.getSymbol().equals(inv.getArgument(1)))
                        .map(TradeRecord::getRealizedPnl)
                        .reduce(BigDecimal.ZERO, BigDecimal::add));
        when(mockStore.saveOpenPosition(anyLong(), any())).thenAnswer(inv -> {
            Position position = inv.getArgument(1);
            Long id = position.getId() != null ? position.getId() : positionIds.incrementAndGet();
            return position.toBuilder().id(id).build();
        });
        when(mockStore.archivePosition(anyLong(), any(), any(), any())).thenAnswer(inv -> {
            Position position = inv.getArgument(1);
            HistoryEntry entry = HistoryEntry.builder()
                    .id(position.getId())
                    .symbol(position.getSymbol())
                    .exchange(position.getExchange())
                    .currency(position.getCurrency())
                    .openTime(position.getOpenTime())
                    .closeTime(inv.getArgument(2))
                    .realizedPnl(inv.getArgument(3))
                    .build();
            history.put(entry.getId(), entry);
            return entry.toBuilder().build();
        });
        when(mockStore.findLatestHistory(anyLong(), anyString(), anyString()))
                .thenAnswer(inv -> history.values().stream()
                        .filter(entry -> entry.getSymbol().equals(inv.getArgument(1)))
                        .reduce((first, second) -> second)
                        .map(entry -> entry.toBuilder().build()));
        when(mockStore.findHistory(anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(history.get(inv.<Long>getArgument(0)))
                        .map(entry -> entry.toBuilder().build()));
        doAnswer(inv -> {
                    HistoryEntry entry = history.get(inv.<Long>getArgument(0));
                    if (entry != null) {
                        entry.setOpenTime(inv.getArgument(1));
                        entry.setCloseTime(inv.getArgument(2));
                        entry.setRealizedPnl(inv.getArgument(3));
                    }
                    return null;
                })
                .when(mockStore)
                .updateHistory(anyLong(), any(), any(), any());
        return mockStore;
    }

    private static OrderRequest market(String side, String qty) {
        return OrderRequest.builder()
                .symbol("AAPL")
                .quantity(new BigDecimal(qty))
                .side(side)
                .build();
    }

    /** Submits from another thread, works the job as the sync worker would and returns the answer. */
    private OrderResult submitAndWork(OrderRequest request, String key) throws Exception {
        CompletableFuture<OrderResult> answer =
                CompletableFuture.supplyAsync(() -> submissionService.enqueueOrder(request, key, Duration.ofSeconds(5)));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        OrderJob job;
        while ((job = queue.poll()) == null) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("No job was queued");
            }
            Thread.sleep(5);
        }
        submissionService.complete(job, executor.execute(job));
        OrderResult result = answer.get(5, TimeUnit.SECONDS);

        gateway.pumpEvents(handler, Duration.ZERO);
        return result;
    }

    @Test
    @DisplayName("A filled buy opens a position carrying the reported commission")
    void buyOpensPosition() throws Exception {
        OrderResult result = submitAndWork(market("BUY", "10"), "buy-1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatus()).isEqualTo("Filled");
        assertThat(result.getAvgFillPrice()).isEqualByComparingTo("100");

        List<Position> positions = cache.snapshotPositions();
        assertThat(positions).hasSize(1);
        Position aapl = positions.get(0);
        assertThat(aapl.positionKey()).isEqualTo(AAPL);
        assertThat(aapl.getQuantity()).isEqualByComparingTo("10");
        assertThat(aapl.getAvgCost()).isEqualByComparingTo("100.1");
        assertThat(aapl.getContractId()).isNotNull();
        assertThat(session.getSubscribedContracts()).containsExactly(aapl.getContractId());
        assertThat(trades).containsOnlyKeys("SIM.1.1");
        assertThat(trades.get("SIM.1.1").getCommission()).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("Selling the whole position archives it with the venue's realized PnL")
    void sellArchivesPosition() throws Exception {
        submitAndWork(market("BUY", "10"), "buy-1");
        gateway.setMarkPrice("AAPL", new BigDecimal("110"));

        OrderResult result = submitAndWork(market("SELL", "10"), "sell-1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(cache.snapshotPositions()).isEmpty();
        assertThat(session.getSubscribedContracts()).isEmpty();

        // 1100 proceeds - 1 commission - 1001 cost basis
        List<HistoryEntry> closed = cache.snapshotHistory();
        assertThat(closed).hasSize(1);
        assertThat(closed.get(0).getSymbol()).isEqualTo("AAPL");
        assertThat(closed.get(0).getRealizedPnl()).isEqualByComparingTo("98");
        assertThat(cache.snapshotAccountPnL().getRealizedPnl()).isEqualByComparingTo("98");
    }

    @Test
    @DisplayName("Live valuations reach the cache and are written back by the flusher")
    void valuationsFlowThroughFlush() throws Exception {
        submitAndWork(market("BUY", "10"), "buy-1");
        gateway.setMarkPrice("AAPL", new BigDecimal("105"));

        gateway.pumpEvents(handler, Duration.ZERO);

        Position aapl = cache.getPosition(AAPL).orElseThrow();
        assertThat(aapl.getUnrealizedPnl()).isEqualByComparingTo("49");
        assertThat(cache.snapshotAccountPnL().getTotalPnl()).isEqualByComparingTo("49");

        flusher.flush(session);

        verify(store).updatePositionValuations(eq(ACCOUNT_ID), anyMap());
        assertThat(session.getValuationBuffer().hasPending()).isFalse();
    }

    @Test
    @DisplayName("Replaying executions in a new session does not book them twice")
    void replayAfterReconnectIsIdempotent() throws Exception {
        submitAndWork(market("BUY", "10"), "buy-1");
        handler.closeSession();

        SyncSession reconnected = new SyncSession(ACCOUNT, ACCOUNT_ID, "USD");
        handler.openSession(reconnected);
        handler.replay();

        assertThat(trades).hasSize(1);
        assertThat(cache.snapshotPositions()).singleElement().satisfies(position -> {
            assertThat(position.getQuantity()).isEqualByComparingTo("10");
            assertThat(position.getAvgCost()).isEqualByComparingTo("100.1");
        });
        assertThat(cache.snapshotAccountPnL().getRealizedPnl()).isEqualByComparingTo("0");
        assertThat(reconnected.getSubscribedContracts()).hasSize(1);
    }

    @Test
    @DisplayName("A repeated idempotency key answers from the first submission")
    void repeatedKeyNotResubmitted() throws Exception {
        OrderResult first = submitAndWork(market("BUY", "10"), "buy-1");

        OrderResult second = submissionService.enqueueOrder(market("BUY", "10"), "buy-1", Duration.ofMillis(50));

        assertThat(second.getOrderId()).isEqualTo(first.getOrderId());
        assertThat(queue.size()).isZero();
        assertThat(cache.getPosition(AAPL).orElseThrow().getQuantity()).isEqualByComparingTo("10");
    }
}
