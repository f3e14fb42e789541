package com.ledgersync.oms;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-request completion signals. A submitting thread registers and waits; the sync worker
 * completes. A waiter that timed out stays registered, so a late result is still delivered
 * to anyone holding the future.
 */
@Component
public class OrderWaiters {

    private static final Logger log = LoggerFactory.getLogger(OrderWaiters.class);

    private final Map<String, CompletableFuture<OrderResult>> waiters = new ConcurrentHashMap<>();

    public CompletableFuture<OrderResult> register(String requestId) {
        CompletableFuture<OrderResult> future = new CompletableFuture<>();
        waiters.put(requestId, future);
        return future;
    }

    /** @return false if nobody was waiting for {@code requestId} */
    public boolean complete(String requestId, OrderResult result) {
        CompletableFuture<OrderResult> future = waiters.remove(requestId);
        if (future == null) {
            return false;
        }
        future.complete(result);
        return true;
    }

    public void remove(String requestId) {
        waiters.remove(requestId);
    }

    /** Resolves every outstanding waiter with the result built for its request id. */
    public int failAll(Function<String, OrderResult> resultFor) {
        List<String> requestIds = List.copyOf(waiters.keySet());
        int failed = 0;
        for (String requestId : requestIds) {
            if (complete(requestId, resultFor.apply(requestId))) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Failed {} pending order waiters", failed);
        }
        return failed;
    }

    public int size() {
        return waiters.size();
    }
}
