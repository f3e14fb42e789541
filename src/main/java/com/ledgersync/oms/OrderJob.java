package com.ledgersync.oms;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** A validated order waiting on the queue for the sync worker. */
@Value
@Builder
public class OrderJob {

    String requestId;
    ValidatedOrder order;

    /** Null when the caller did not supply one. */
    String idempotencyKey;

    Instant enqueuedAt;
}
