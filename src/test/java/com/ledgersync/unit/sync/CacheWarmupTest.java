package com.ledgersync.unit.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgersync.cache.LedgerCache;
import com.ledgersync.domain.model.Account;
import com.ledgersync.domain.model.LedgerSnapshot;
import com.ledgersync.domain.model.Position;
import com.ledgersync.exception.StorageException;
import com.ledgersync.persistence.LedgerStore;
import com.ledgersync.sync.CacheWarmup;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CacheWarmup: startup hydration from the stored account and the cases where
 * it must leave the cache alone.
 */
class CacheWarmupTest {

    private static final Instant NOW = Instant.parse("2024-03-15T15:00:00Z");

    private LedgerCache cache;
    private LedgerStore store;
    private CacheWarmup warmup;

    @BeforeEach
    void setUp() {
        cache = new LedgerCache(Clock.fixed(NOW, ZoneOffset.UTC));
        store = mock(LedgerStore.class);
        warmup = new CacheWarmup(cache, store);
    }

    private static LedgerSnapshot snapshotWithOnePosition() {
        return LedgerSnapshot.builder()
                .accountId(4L)
                .baseCurrency("USD")
                .realizedTotal(new BigDecimal("250"))
                .positions(List.of(Position.builder()
                        .id(11L)
                        .symbol("AAPL")
                        .exchange("SMART")
                        .currency("USD")
                        .quantity(new BigDecimal("10"))
                        .avgCost(new BigDecimal("100"))
                        .totalCost(new BigDecimal("1000"))
                        .openTime(NOW)
                        .build()))
                .history(List.of())
                .accountSummary(Map.of())
                .dailyPnl(Map.of())
                .build();
    }

    @Test
    @DisplayName("Hydrates from the first stored account")
    void hydratesFromStoredAccount() {
        when(store.findDefaultAccount()).thenReturn(Optional.of(Account.builder()
                .id(4L)
                .externalAccount("U1")
                .baseCurrency("USD")
                .build()));
        when(store.loadSnapshot(4L, "USD")).thenReturn(snapshotWithOnePosition());

        assertThat(warmup.warmUp()).isTrue();

        assertThat(cache.isInitialized()).isTrue();
        assertThat(cache.getAccountId()).isEqualTo(4L);
        assertThat(cache.snapshotPositions()).hasSize(1);
        assertThat(cache.snapshotAccountPnL().getRealizedPnl()).isEqualByComparingTo("250");
    }

    @Test
    @DisplayName("Without a stored account the cache stays empty")
    void noStoredAccount() {
        when(store.findDefaultAccount()).thenReturn(Optional.empty());

        assertThat(warmup.warmUp()).isFalse();
        assertThat(cache.isInitialized()).isFalse();
    }

    @Test
    @DisplayName("A cache already hydrated by the sync worker is not touched")
    void skipsInitializedCache() {
        cache.hydrate(snapshotWithOnePosition());

        assertThat(warmup.warmUp()).isFalse();
        verify(store, never()).loadSnapshot(anyLong(), anyString());
    }

    @Test
    @DisplayName("A storage failure is logged and leaves the cache empty")
    void storageFailureIsSoft() {
        when(store.findDefaultAccount()).thenThrow(new StorageException("db down"));

        assertThat(warmup.warmUp()).isFalse();
        assertThat(cache.isInitialized()).isFalse();
    }
}
