package com.ledgersync.unit.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.ledgersync.cache.LedgerCache;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.domain.model.DailyPnLPoint;
import com.ledgersync.domain.model.PositionValuation;
import com.ledgersync.exception.StorageException;
import com.ledgersync.observability.SyncMetrics;
import com.ledgersync.oms.OrderQueue;
import com.ledgersync.persistence.LedgerStore;
import com.ledgersync.sync.CacheFlusher;
import com.ledgersync.sync.SyncSession;
import com.ledgersync.sync.SyncStatusTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for CacheFlusher: what a write-back pass sends to storage and that dirty state
 * survives a failed write.
 */
class CacheFlusherTest {

    private static final Instant NOW = Instant.parse("2024-03-15T15:00:00Z");
    private static final long ACCOUNT_ID = 7L;

    private LedgerCache cache;
    private LedgerStore store;
    private SyncSession session;
    private CacheFlusher flusher;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        SyncProperties properties = new SyncProperties();
        cache = new LedgerCache(clock);
        cache.setAccount(ACCOUNT_ID, "USD");
        store = mock(LedgerStore.class);
        SyncMetrics metrics =
                new SyncMetrics(new SimpleMeterRegistry(), new OrderQueue(properties), new SyncStatusTracker(clock));
        flusher = new CacheFlusher(cache, store, metrics);
        session = new SyncSession("U1", ACCOUNT_ID, "USD");
    }

    @Test
    @DisplayName("Nothing dirty means no storage writes")
    void idleFlushWritesNothing() {
        flusher.flush(session);

        verify(store, never()).updatePositionValuations(anyLong(), anyMap());
        verify(store, never()).upsertAccountSummary(anyLong(), anyMap());
        verify(store, never()).upsertDailyPnL(anyLong(), any());
    }

    @Test
    @DisplayName("Buffered valuations are written as one batch and then cleared")
    @SuppressWarnings("unchecked")
    void writesValuationBatch() {
        session.getValuationBuffer().offer(1L, new PositionValuation(new BigDecimal("10"), null));
        session.getValuationBuffer().offer(2L, new PositionValuation(new BigDecimal("-3"), new BigDecimal("1")));

        flusher.flush(session);

        ArgumentCaptor<Map<Long, PositionValuation>> captor = ArgumentCaptor.forClass(Map.class);
        verify(store).updatePositionValuations(eq(ACCOUNT_ID), captor.capture());
        assertThat(captor.getValue()).containsOnlyKeys(1L, 2L);
        assertThat(session.getValuationBuffer().hasPending()).isFalse();
    }

    @Test
    @DisplayName("Dirty summary fields are upserted and cleared after success")
    @SuppressWarnings("unchecked")
    void writesSummaryFields() {
        cache.updateAccountSummaryField(AccountSummaryField.NET_LIQUIDATION, new BigDecimal("100000"));

        flusher.flush(session);

        ArgumentCaptor<Map<AccountSummaryField, BigDecimal>> captor = ArgumentCaptor.forClass(Map.class);
        verify(store).upsertAccountSummary(eq(ACCOUNT_ID), captor.capture());
        assertThat(captor.getValue().get(AccountSummaryField.NET_LIQUIDATION)).isEqualByComparingTo("100000");
        assertThat(cache.collectDirty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Only the rolled trading date's final daily PnL is written")
    void writesRolledDailyPoint() {
        LocalDate thursday = LocalDate.of(2024, 3, 14);
        cache.updateDailyPnL(thursday, new BigDecimal("25"));
        cache.updateDailyPnL(thursday.plusDays(1), new BigDecimal("5"));

        flusher.flush(session);

        ArgumentCaptor<DailyPnLPoint> captor = ArgumentCaptor.forClass(DailyPnLPoint.class);
        verify(store).upsertDailyPnL(eq(ACCOUNT_ID), captor.capture());
        assertThat(captor.getValue().getTradeDate()).isEqualTo(thursday);
        assertThat(captor.getValue().getDailyPnl()).isEqualByComparingTo("25");
        assertThat(cache.collectDirty().hasDailyPayload()).isFalse();
    }

    @Test
    @DisplayName("A failed write leaves summary fields dirty for the next pass")
    void failedWriteKeepsDirtyState() {
        cache.updateAccountSummaryField(AccountSummaryField.TOTAL_CASH_VALUE, new BigDecimal("5000"));
        doThrow(new StorageException("db down")).when(store).upsertAccountSummary(anyLong(), anyMap());

        assertThatThrownBy(() -> flusher.flush(session)).isInstanceOf(StorageException.class);

        assertThat(cache.collectDirty().summaryFields()).containsExactly(AccountSummaryField.TOTAL_CASH_VALUE);
    }
}
