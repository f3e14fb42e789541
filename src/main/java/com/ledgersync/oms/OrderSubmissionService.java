package com.ledgersync.oms;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.exception.ErrorCode;
import com.ledgersync.exception.ValidationException;
import com.ledgersync.observability.SyncMetrics;
import com.ledgersync.sync.SyncStatusTracker;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for order submission from the serving layer.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Read-only check</li>
 *   <li>Validation and normalization ({@link OrderValidator})</li>
 *   <li>Session check: no queueing while the venue session is down</li>
 *   <li>Idempotency: a repeated key answers from the first submission</li>
 *   <li>Non-blocking enqueue; a full queue fails at once</li>
 *   <li>Wait for the worker's result up to the timeout, else answer PENDING</li>
 * </ol>
 *
 * <p>A PENDING answer does not abandon the order: the worker still processes it and records
 * the result under the idempotency key.
 */
@Service
public class OrderSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(OrderSubmissionService.class);

    private final SyncProperties syncProperties;
    private final OrderValidator orderValidator;
    private final OrderQueue orderQueue;
    private final OrderWaiters orderWaiters;
    private final OrderIdempotencyStore orderIdempotencyStore;
    private final SyncStatusTracker syncStatusTracker;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    public OrderSubmissionService(
            SyncProperties syncProperties,
            OrderValidator orderValidator,
            OrderQueue orderQueue,
            OrderWaiters orderWaiters,
            OrderIdempotencyStore orderIdempotencyStore,
            SyncStatusTracker syncStatusTracker,
            SyncMetrics syncMetrics,
            Clock clock) {
        this.syncProperties = syncProperties;
        this.orderValidator = orderValidator;
        this.orderQueue = orderQueue;
        this.orderWaiters = orderWaiters;
        this.orderIdempotencyStore = orderIdempotencyStore;
        this.syncStatusTracker = syncStatusTracker;
        this.syncMetrics = syncMetrics;
        this.clock = clock;
    }

    public OrderResult enqueueOrder(OrderRequest request, String idempotencyKey) {
        return enqueueOrder(request, idempotencyKey, syncProperties.getOrderTimeout());
    }

    /**
     * Queues an order for the sync worker and waits up to {@code timeout} for its result.
     *
     * @param idempotencyKey optional; when given it is also the request id
     * @return SUCCESS or FAILURE from the worker, PENDING if it is still queued after the
     *     timeout, or FAILURE at once for read-only mode, invalid input, a down session or a
     *     full queue
     */
    public OrderResult enqueueOrder(OrderRequest request, String idempotencyKey, Duration timeout) {
        if (syncProperties.isReadOnly()) {
            log.warn("Order rejected: read-only mode [symbol={}]", request.getSymbol());
            return rejected(OrderResult.failure(null, ErrorCode.READ_ONLY, "Read-only mode is enabled"));
        }

        ValidatedOrder order;
        try {
            order = orderValidator.validate(request);
        } catch (ValidationException e) {
            log.warn("Order rejected: {} [symbol={}]", e.getMessage(), request.getSymbol());
            return rejected(OrderResult.failure(null, e.getErrorCode(), e.getMessage()));
        }

        if (!syncStatusTracker.current().isConnected()) {
            log.warn("Order rejected: venue session down [symbol={}]", request.getSymbol());
            return rejected(OrderResult.disconnected(null));
        }

        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;
        String requestId = key != null ? key : UUID.randomUUID().toString().replace("-", "");
        if (key != null) {
            OrderResult previous = orderIdempotencyStore.reserve(key, requestId).orElse(null);
            if (previous != null) {
                return previous;
            }
        }

        CompletableFuture<OrderResult> waiter = orderWaiters.register(requestId);
        OrderJob job = OrderJob.builder()
                .requestId(requestId)
                .order(order)
                .idempotencyKey(key)
                .enqueuedAt(clock.instant())
                .build();
        if (!orderQueue.offer(job)) {
            orderWaiters.remove(requestId);
            if (key != null) {
                orderIdempotencyStore.forget(key);
            }
            log.warn("Order rejected: queue full [requestId={}, queueSize={}]", requestId, orderQueue.size());
            return rejected(OrderResult.failure(requestId, ErrorCode.QUEUE_FULL, "Order queue full"));
        }

        log.info(
                "Order queued: requestId={}, symbol={}, side={}, qty={}, type={}, price={}",
                requestId,
                order.getInstrument().getSymbol(),
                order.getOrder().getSide(),
                order.getOrder().getQuantity(),
                order.getOrder().getType(),
                order.getOrder().getLimitPrice());

        try {
            return waiter.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("Order still queued after {}ms: requestId={}", timeout.toMillis(), requestId);
            return OrderResult.pending(requestId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OrderResult.pending(requestId);
        } catch (ExecutionException e) {
            log.error("Order waiter failed: requestId={}", requestId, e);
            return OrderResult.failure(requestId, ErrorCode.INTERNAL_ERROR, e.getCause().getMessage());
        }
    }

    /** Delivers a processed job's result to its waiter and idempotency entry. Worker thread. */
    public void complete(OrderJob job, OrderResult result) {
        if (result.isSuccess()) {
            syncMetrics.orderPlaced();
        } else if (result.isFailure()) {
            syncMetrics.orderFailed();
        }
        if (job.getIdempotencyKey() != null) {
            orderIdempotencyStore.complete(job.getIdempotencyKey(), result);
        }
        if (!orderWaiters.complete(job.getRequestId(), result)) {
            log.debug("Order result with no waiter: requestId={}, outcome={}", job.getRequestId(), result.getOutcome());
        }
    }

    /**
     * Fails every queued job and every outstanding waiter with a "disconnected" result.
     * Called when the venue session ends.
     */
    public void failAllPending() {
        List<OrderJob> queued = orderQueue.drain();
        for (OrderJob job : queued) {
            complete(job, OrderResult.disconnected(job.getRequestId()));
        }
        orderWaiters.failAll(OrderResult::disconnected);
    }

    private OrderResult rejected(OrderResult result) {
        syncMetrics.orderFailed();
        return result;
    }
}
