package com.ledgersync.oms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ledgersync.config.SyncProperties;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Remembers order submissions by caller-supplied idempotency key, so a retried submission
 * does not place a second order.
 *
 * <p>A key is reserved when its order is queued and answers PENDING with the original
 * request id until the order is processed; after that it answers with the stored result.
 * Failed submissions are forgotten so the caller can retry. Entries expire after the
 * configured TTL (one hour by default).
 */
@Component
public class OrderIdempotencyStore {

    private static final Logger log = LoggerFactory.getLogger(OrderIdempotencyStore.class);

    private final Cache<String, Entry> entries;

    public OrderIdempotencyStore(SyncProperties syncProperties) {
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(syncProperties.getOrderIdempotencyTtl())
                .maximumSize(10_000)
                .build();
    }

    /**
     * Reserves {@code key} for {@code requestId}.
     *
     * @return empty if the key was free and is now reserved, otherwise the answer to give the
     *     repeated submission
     */
    public Optional<OrderResult> reserve(String key, String requestId) {
        Entry existing = entries.asMap().putIfAbsent(key, new Entry(requestId, null));
        if (existing == null) {
            return Optional.empty();
        }
        log.debug("Repeated order submission: key={}, requestId={}", key, existing.requestId());
        return Optional.of(existing.result() != null ? existing.result() : OrderResult.pending(existing.requestId()));
    }

    /** Stores the final result, or forgets the key if the order failed. */
    public void complete(String key, OrderResult result) {
        if (result.isFailure()) {
            entries.invalidate(key);
        } else if (result.isSuccess()) {
            entries.asMap().computeIfPresent(key, (k, entry) -> new Entry(entry.requestId(), result));
        }
    }

    public void forget(String key) {
        entries.invalidate(key);
    }

    private record Entry(String requestId, OrderResult result) {}
}
