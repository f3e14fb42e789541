package com.ledgersync.sync;

import com.ledgersync.cache.LedgerCache;
import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.enums.AccountSummaryField;
import com.ledgersync.observability.SyncMetrics;
import com.ledgersync.oms.OrderExecutor;
import com.ledgersync.oms.OrderJob;
import com.ledgersync.oms.OrderQueue;
import com.ledgersync.oms.OrderResult;
import com.ledgersync.oms.OrderSubmissionService;
import com.ledgersync.persistence.LedgerStore;
import com.ledgersync.venue.VenueGateway;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Owns the venue session on a dedicated worker thread.
 *
 * <p>Each session connects, binds the ledger account, replays executions and positions,
 * subscribes to account valuation streams and then ticks until the connection fails or the
 * manager is stopped. Every tick pumps venue events, executes queued orders and runs the
 * periodic keepalive and cache write-back. A failed session is torn down (waiting order
 * submitters are answered with "disconnected") and retried with exponential backoff.
 *
 * <p>All venue calls and all ledger writes happen on the worker thread.
 */
@Component
public class VenueSyncManager implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(VenueSyncManager.class);

    static final String LOCAL_ACCOUNT = "LOCAL";

    private final VenueGateway venueGateway;
    private final VenueEventHandler venueEventHandler;
    private final CacheFlusher cacheFlusher;
    private final LedgerCache ledgerCache;
    private final LedgerStore ledgerStore;
    private final OrderQueue orderQueue;
    private final OrderExecutor orderExecutor;
    private final OrderSubmissionService orderSubmissionService;
    private final SyncStatusTracker syncStatusTracker;
    private final SyncMetrics syncMetrics;
    private final SyncProperties syncProperties;
    private final Clock clock;
    private final ReconnectBackoff backoff;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private Thread workerThread;

    public VenueSyncManager(
            VenueGateway venueGateway,
            VenueEventHandler venueEventHandler,
            CacheFlusher cacheFlusher,
            LedgerCache ledgerCache,
            LedgerStore ledgerStore,
            OrderQueue orderQueue,
            OrderExecutor orderExecutor,
            OrderSubmissionService orderSubmissionService,
            SyncStatusTracker syncStatusTracker,
            SyncMetrics syncMetrics,
            SyncProperties syncProperties,
            Clock clock) {
        this.venueGateway = venueGateway;
        this.venueEventHandler = venueEventHandler;
        this.cacheFlusher = cacheFlusher;
        this.ledgerCache = ledgerCache;
        this.ledgerStore = ledgerStore;
        this.orderQueue = orderQueue;
        this.orderExecutor = orderExecutor;
        this.orderSubmissionService = orderSubmissionService;
        this.syncStatusTracker = syncStatusTracker;
        this.syncMetrics = syncMetrics;
        this.syncProperties = syncProperties;
        this.clock = clock;
        this.backoff =
                new ReconnectBackoff(syncProperties.getReconnectMinDelay(), syncProperties.getReconnectMaxDelay());
    }

    /** Starts the worker thread. A second call while running is a no-op. */
    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            stopSignal = new CountDownLatch(1);
            backoff.reset();
            syncStatusTracker.markStarted();
            workerThread = new Thread(this::runLoop, "venue-sync");
            workerThread.setDaemon(true);
            workerThread.start();
            log.info("VenueSyncManager started");
        }
    }

    /**
     * Signals the worker to stop and waits briefly for it to finish its teardown. A stop
     * during a backoff sleep takes effect immediately.
     */
    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            stopSignal.countDown();
            Thread worker = workerThread;
            if (worker != null) {
                worker.interrupt();
                try {
                    worker.join(TimeUnit.SECONDS.toMillis(5));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            syncStatusTracker.markStopped();
            log.info("VenueSyncManager stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // After the web and persistence layers, before nothing else
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public boolean isAutoStartup() {
        return syncProperties.isAutoStart();
    }

    public SyncStatus status() {
        return syncStatusTracker.current();
    }

    // ===== Worker =====

    private void runLoop() {
        while (running.get()) {
            String error = null;
            try {
                runSession();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = running.get() ? "interrupted" : null;
            } catch (RuntimeException e) {
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("Venue session failed: {}", error, e);
            } finally {
                teardown(error);
            }

            if (!running.get()) {
                break;
            }
            // Interrupt flag must not leak into the backoff wait
            Thread.interrupted();
            Duration delay = backoff.nextDelay();
            syncMetrics.reconnect();
            log.info("Reconnecting to venue in {}ms (attempt {})", delay.toMillis(), backoff.getAttempt());
            try {
                if (stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (!running.get()) {
                    break;
                }
            }
        }
        log.info("Venue sync worker exited");
    }

    private void runSession() throws InterruptedException {
        syncStatusTracker.markConnecting();
        venueGateway.connect();

        SyncSession session = bindAccount();
        venueEventHandler.openSession(session);
        syncStatusTracker.markConnected();
        backoff.reset();
        log.info("Venue session open: account={}, accountId={}", session.getAccountCode(), session.getAccountId());

        venueEventHandler.replay();
        venueGateway.subscribeAccountPnL(session.getAccountCode());
        venueGateway.subscribeAccountSummary(session.getAccountCode(), AccountSummaryField.venueTags());

        Instant lastKeepalive = clock.instant();
        Instant lastFlush = clock.instant();
        Instant lastQueueLog = clock.instant();
        while (running.get()) {
            if (!venueGateway.isConnected()) {
                throw new IllegalStateException("Venue connection lost");
            }
            venueGateway.pumpEvents(venueEventHandler, syncProperties.getTickInterval());
            drainOrders();

            Instant now = clock.instant();
            if (due(lastKeepalive, syncProperties.getKeepaliveInterval(), now)) {
                Instant venueTime = venueGateway.requestCurrentTime();
                log.trace("Keepalive ok, venue time {}", venueTime);
                lastKeepalive = now;
            }
            if (due(lastFlush, syncProperties.getCacheFlushInterval(), now)) {
                cacheFlusher.flush(session);
                lastFlush = now;
            }
            if (due(lastQueueLog, syncProperties.getQueueLogInterval(), now)) {
                log.debug("Order queue size={}", orderQueue.size());
                lastQueueLog = now;
            }
        }
    }

    private SyncSession bindAccount() {
        String accountCode = resolveAccountCode();
        String baseCurrency = syncProperties.getBaseCurrency();
        long accountId = ledgerStore.upsertAccount(accountCode, baseCurrency);
        if (!ledgerCache.isInitialized() || !Objects.equals(ledgerCache.getAccountId(), accountId)) {
            ledgerCache.hydrate(ledgerStore.loadSnapshot(accountId, baseCurrency));
        }
        ledgerCache.setAccount(accountId, baseCurrency);
        return new SyncSession(accountCode, accountId, baseCurrency);
    }

    String resolveAccountCode() {
        String configured = syncProperties.getAccount();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        List<String> managed = venueGateway.getManagedAccounts();
        if (managed != null && !managed.isEmpty()) {
            return managed.get(0);
        }
        return LOCAL_ACCOUNT;
    }

    private void drainOrders() {
        OrderJob job;
        while ((job = orderQueue.poll()) != null) {
            OrderResult result = orderExecutor.execute(job);
            orderSubmissionService.complete(job, result);
        }
    }

    /** Final flush, disconnect and failure of every waiting submitter. */
    private void teardown(String error) {
        SyncSession session = venueEventHandler.getSession();
        if (session != null) {
            try {
                cacheFlusher.flush(session);
            } catch (RuntimeException e) {
                log.warn("Final cache flush failed: {}", e.getMessage());
            }
        }
        try {
            venueGateway.disconnect();
        } catch (RuntimeException e) {
            log.warn("Venue disconnect failed: {}", e.getMessage());
        }
        venueEventHandler.closeSession();
        orderSubmissionService.failAllPending();
        syncStatusTracker.markDisconnected(error);
        if (error != null) {
            log.warn("Venue session closed: {}", error);
        } else {
            log.info("Venue session closed");
        }
    }

    private static boolean due(Instant last, Duration interval, Instant now) {
        return interval != null && !interval.isZero() && !now.isBefore(last.plus(interval));
    }
}
