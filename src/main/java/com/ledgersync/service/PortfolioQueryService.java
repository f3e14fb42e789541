package com.ledgersync.service;

import com.ledgersync.cache.LedgerCache;
import com.ledgersync.domain.model.AccountPnL;
import com.ledgersync.domain.model.AccountSummary;
import com.ledgersync.domain.model.DailyPnLPoint;
import com.ledgersync.domain.model.HistoryEntry;
import com.ledgersync.domain.model.Position;
import com.ledgersync.oms.OrderRequest;
import com.ledgersync.oms.OrderResult;
import com.ledgersync.oms.OrderSubmissionService;
import com.ledgersync.sync.SyncStatus;
import com.ledgersync.sync.VenueSyncManager;
import java.time.Duration;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Facade for the serving layer. Reads come from cache snapshots and never touch storage or
 * the venue; orders go through the submission queue.
 */
@Service
public class PortfolioQueryService {

    private final LedgerCache ledgerCache;
    private final VenueSyncManager venueSyncManager;
    private final OrderSubmissionService orderSubmissionService;

    public PortfolioQueryService(
            LedgerCache ledgerCache,
            VenueSyncManager venueSyncManager,
            OrderSubmissionService orderSubmissionService) {
        this.ledgerCache = ledgerCache;
        this.venueSyncManager = venueSyncManager;
        this.orderSubmissionService = orderSubmissionService;
    }

    /** Open positions sorted by symbol. */
    public List<Position> getPositions() {
        return ledgerCache.snapshotPositions();
    }

    /** Closed positions, most recent close first. */
    public List<HistoryEntry> getHistory() {
        return ledgerCache.snapshotHistory();
    }

    public AccountPnL getAccountPnL() {
        return ledgerCache.snapshotAccountPnL();
    }

    public AccountSummary getAccountSummary() {
        return ledgerCache.snapshotAccountSummary();
    }

    /** Daily PnL with its running cumulative, oldest trading date first. */
    public List<DailyPnLPoint> getDailyPnL() {
        return ledgerCache.snapshotDailyPnL();
    }

    public SyncStatus getStatus() {
        return venueSyncManager.status();
    }

    public boolean isReady() {
        return ledgerCache.isInitialized();
    }

    public OrderResult enqueueOrder(OrderRequest request, String idempotencyKey) {
        return orderSubmissionService.enqueueOrder(request, idempotencyKey);
    }

    public OrderResult enqueueOrder(OrderRequest request, String idempotencyKey, Duration timeout) {
        return orderSubmissionService.enqueueOrder(request, idempotencyKey, timeout);
    }
}
