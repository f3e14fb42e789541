package com.ledgersync.sync;

import com.ledgersync.cache.FlushPayload;
import com.ledgersync.cache.LedgerCache;
import com.ledgersync.domain.model.PositionValuation;
import com.ledgersync.observability.SyncMetrics;
import com.ledgersync.persistence.LedgerStore;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes back what the cache holds ahead of durable storage: buffered position valuations,
 * dirty account summary fields and the staged final daily PnL of a rolled trading date.
 *
 * <p>Dirty state is cleared only after the write succeeded, so a failed flush is retried on
 * the next tick.
 */
@Component
public class CacheFlusher {

    private static final Logger log = LoggerFactory.getLogger(CacheFlusher.class);

    private final LedgerCache ledgerCache;
    private final LedgerStore ledgerStore;
    private final SyncMetrics syncMetrics;

    public CacheFlusher(LedgerCache ledgerCache, LedgerStore ledgerStore, SyncMetrics syncMetrics) {
        this.ledgerCache = ledgerCache;
        this.ledgerStore = ledgerStore;
        this.syncMetrics = syncMetrics;
    }

    public void flush(SyncSession session) {
        long start = System.nanoTime();
        long accountId = session.getAccountId();

        PositionValuationBuffer buffer = session.getValuationBuffer();
        int valuations = 0;
        if (buffer.hasPending()) {
            Map<Long, PositionValuation> pending = buffer.pending();
            ledgerStore.updatePositionValuations(accountId, pending);
            buffer.clear(pending);
            valuations = pending.size();
        }

        FlushPayload payload = ledgerCache.collectDirty();
        if (payload.hasDailyPayload()) {
            ledgerStore.upsertDailyPnL(accountId, payload.getDailyPayload());
        }
        if (payload.hasSummary()) {
            ledgerStore.upsertAccountSummary(accountId, payload.getSummaryValues());
        }
        if (!payload.isEmpty()) {
            ledgerCache.clearDirty(payload);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        syncMetrics.recordFlush(elapsed);
        if (valuations > 0 || !payload.isEmpty()) {
            log.debug(
                    "Flushed {} valuations, {} summary fields, daily={} in {}ms",
                    valuations,
                    payload.summaryFields().size(),
                    payload.hasDailyPayload(),
                    elapsed.toMillis());
        }
    }
}
