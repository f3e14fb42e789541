package com.ledgersync.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgersync.cache.LedgerCache;
import com.ledgersync.cache.PositionUpdate;
import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.domain.enums.SyncState;
import com.ledgersync.domain.model.HistoryEntry;
import com.ledgersync.domain.model.Position;
import com.ledgersync.domain.vo.PositionKey;
import com.ledgersync.oms.OrderRequest;
import com.ledgersync.oms.OrderResult;
import com.ledgersync.oms.OrderSubmissionService;
import com.ledgersync.service.PortfolioQueryService;
import com.ledgersync.sync.SyncStatus;
import com.ledgersync.sync.VenueSyncManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PortfolioQueryService reading from a real cache, with the sync manager and
 * order submission mocked.
 */
class PortfolioQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T15:00:00Z");

    private LedgerCache cache;
    private VenueSyncManager syncManager;
    private OrderSubmissionService submissionService;
    private PortfolioQueryService service;

    @BeforeEach
    void setUp() {
        cache = new LedgerCache(Clock.fixed(NOW, ZoneOffset.UTC));
        syncManager = mock(VenueSyncManager.class);
        submissionService = mock(OrderSubmissionService.class);
        service = new PortfolioQueryService(cache, syncManager, submissionService);
    }

    private void open(String symbol, long id, String qty, String avg) {
        BigDecimal quantity = new BigDecimal(qty);
        BigDecimal avgCost = new BigDecimal(avg);
        cache.upsertPosition(PositionUpdate.builder()
                .id(id)
                .key(PositionKey.of(symbol, "SMART", "USD"))
                .quantity(quantity)
                .avgCost(avgCost)
                .totalCost(quantity.multiply(avgCost))
                .openTime(NOW.minusSeconds(3600))
                .build());
    }

    // ===== Reads =====

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("Positions are listed by symbol and are copies of the cached state")
        void positionsSortedAndDetached() {
            open("MSFT", 2L, "5", "300");
            open("AAPL", 1L, "10", "100");

            List<Position> positions = service.getPositions();
            positions.get(0).setQuantity(BigDecimal.ONE);

            assertThat(positions).extracting(Position::getSymbol).containsExactly("AAPL", "MSFT");
            assertThat(service.getPositions().get(0).getQuantity()).isEqualByComparingTo("10");
        }

        @Test
        @DisplayName("History lists the most recent close first")
        void historyNewestFirst() {
            cache.addHistory(HistoryEntry.builder().id(3L).symbol("MSFT").closeTime(NOW.minusSeconds(600)).build());
            cache.addHistory(HistoryEntry.builder().id(4L).symbol("TSLA").closeTime(NOW.minusSeconds(60)).build());

            assertThat(service.getHistory()).extracting(HistoryEntry::getId).containsExactly(4L, 3L);
        }

        @Test
        @DisplayName("Account PnL carries realized executions and the latest daily value")
        void accountPnlCombined() {
            open("AAPL", 1L, "10", "100");
            cache.recordExecRealized("E1", PositionKey.of("AAPL", "SMART", "USD"), new BigDecimal("40"));
            cache.updateDailyPnL(LocalDate.of(2024, 3, 15), new BigDecimal("12"));

            assertThat(service.getAccountPnL().getRealizedPnl()).isEqualByComparingTo("40");
            assertThat(service.getAccountPnL().getDailyPnl()).isEqualByComparingTo("12");
            assertThat(service.getDailyPnL()).singleElement()
                    .satisfies(point -> assertThat(point.getCumulativePnl()).isEqualByComparingTo("12"));
        }

        @Test
        @DisplayName("Account summary returns the cached fields")
        void accountSummary() {
            cache.updateAccountSummaryField(AccountSummaryField.NET_LIQUIDATION, new BigDecimal("100000"));

            assertThat(service.getAccountSummary().get(AccountSummaryField.NET_LIQUIDATION))
                    .isEqualByComparingTo("100000");
        }

        @Test
        @DisplayName("The service is ready once the cache holds state; status comes from the sync manager")
        void readinessAndStatus() {
            SyncStatus status = SyncStatus.builder().running(true).connected(true).state(SyncState.CONNECTED).build();
            when(syncManager.status()).thenReturn(status);

            assertThat(service.isReady()).isFalse();
            open("AAPL", 1L, "10", "100");

            assertThat(service.isReady()).isTrue();
            assertThat(service.getStatus().isConnected()).isTrue();
        }
    }

    // ===== Orders =====

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("Orders are handed to the submission queue unchanged")
        void ordersDelegated() {
            OrderRequest request = OrderRequest.builder()
                    .symbol("AAPL")
                    .quantity(BigDecimal.TEN)
                    .side("BUY")
                    .build();
            OrderResult pending = OrderResult.pending("key-1");
            when(submissionService.enqueueOrder(request, "key-1", Duration.ofSeconds(2))).thenReturn(pending);

            assertThat(service.enqueueOrder(request, "key-1", Duration.ofSeconds(2))).isSameAs(pending);
            verify(submissionService).enqueueOrder(request, "key-1", Duration.ofSeconds(2));
        }
    }
}
