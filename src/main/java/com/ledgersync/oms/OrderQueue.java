package com.ledgersync.oms;

import com.ledgersync.config.SyncProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded FIFO hand-off between submitting threads and the sync worker.
 *
 * <p>Producers never block: {@link #offer} fails at once when the queue is full. The worker
 * drains it with {@link #poll()} on every tick.
 */
@Component
public class OrderQueue {

    private static final Logger log = LoggerFactory.getLogger(OrderQueue.class);

    private final BlockingQueue<OrderJob> queue;

    public OrderQueue(SyncProperties syncProperties) {
        this.queue = new ArrayBlockingQueue<>(syncProperties.getOrderQueueCapacity());
    }

    /** @return false if the queue is full */
    public boolean offer(OrderJob job) {
        boolean accepted = queue.offer(job);
        if (accepted) {
            log.debug("Order enqueued: requestId={}, queueSize={}", job.getRequestId(), queue.size());
        }
        return accepted;
    }

    /** Next job, or null if none is waiting. */
    public OrderJob poll() {
        return queue.poll();
    }

    /** Removes and returns every waiting job. */
    public List<OrderJob> drain() {
        List<OrderJob> drained = new ArrayList<>();
        queue.drainTo(drained);
        if (!drained.isEmpty()) {
            log.info("Order queue drained: {} jobs removed", drained.size());
        }
        return drained;
    }

    public int size() {
        return queue.size();
    }
}
