package com.ledgersync.observability;

import com.ledgersync.oms.OrderQueue;
import com.ledgersync.sync.SyncStatusTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the venue sync worker:
 * <ul>
 *   <li><b>ledgersync.events.processed</b> (counter, tag {@code kind}): venue events handled</li>
 *   <li><b>ledgersync.events.dropped</b> (counter, tag {@code kind}): events discarded as
 *       malformed or out of scope</li>
 *   <li><b>ledgersync.orders.placed</b> / <b>ledgersync.orders.failed</b> (counters)</li>
 *   <li><b>ledgersync.reconnects</b> (counter): sessions that ended and were retried</li>
 *   <li><b>ledgersync.flush</b> (timer): periodic write-back duration</li>
 *   <li><b>ledgersync.order.queue.size</b> (gauge) and <b>ledgersync.session.connected</b>
 *       (gauge 0/1)</li>
 * </ul>
 */
@Service
public class SyncMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter ordersPlacedCounter;
    private final Counter ordersFailedCounter;
    private final Counter reconnectCounter;
    private final Timer flushTimer;

    private final Map<String, Counter> processedByKind = new ConcurrentHashMap<>();
    private final Map<String, Counter> droppedByKind = new ConcurrentHashMap<>();

    public SyncMetrics(MeterRegistry meterRegistry, OrderQueue orderQueue, SyncStatusTracker syncStatusTracker) {
        this.meterRegistry = meterRegistry;

        this.ordersPlacedCounter = Counter.builder("ledgersync.orders.placed")
                .description("Orders accepted by the venue")
                .register(meterRegistry);
        this.ordersFailedCounter = Counter.builder("ledgersync.orders.failed")
                .description("Orders that failed validation, qualification or placement")
                .register(meterRegistry);
        this.reconnectCounter = Counter.builder("ledgersync.reconnects")
                .description("Venue sessions that ended and were retried")
                .register(meterRegistry);
        this.flushTimer = Timer.builder("ledgersync.flush")
                .description("Periodic write-back of cached valuations to storage")
                .register(meterRegistry);

        meterRegistry.gauge("ledgersync.order.queue.size", orderQueue, OrderQueue::size);
        meterRegistry.gauge(
                "ledgersync.session.connected", syncStatusTracker, tracker -> tracker.current().isConnected() ? 1.0 : 0.0);
    }

    public void eventProcessed(String kind) {
        processedByKind
                .computeIfAbsent(kind, k -> Counter.builder("ledgersync.events.processed")
                        .tag("kind", k)
                        .register(meterRegistry))
                .increment();
    }

    public void eventDropped(String kind) {
        droppedByKind
                .computeIfAbsent(kind, k -> Counter.builder("ledgersync.events.dropped")
                        .tag("kind", k)
                        .register(meterRegistry))
                .increment();
    }

    public void orderPlaced() {
        ordersPlacedCounter.increment();
    }

    public void orderFailed() {
        ordersFailedCounter.increment();
    }

    public void reconnect() {
        reconnectCounter.increment();
    }

    public void recordFlush(Duration duration) {
        flushTimer.record(duration);
    }
}
