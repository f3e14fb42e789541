package com.ledgersync.oms;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.enums.OrderOutcome;
import com.ledgersync.domain.model.Instrument;
import com.ledgersync.exception.BaseException;
import com.ledgersync.exception.ErrorCode;
import com.ledgersync.venue.VenueGateway;
import com.ledgersync.venue.VenueOrder;
import com.ledgersync.venue.VenueOrderStatus;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Places one queued order on the venue: qualify the instrument, submit, wait briefly, then
 * read the first status. Runs on the sync worker thread only.
 */
@Component
public class OrderExecutor {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutor.class);

    private final VenueGateway venueGateway;
    private final SyncProperties syncProperties;

    public OrderExecutor(VenueGateway venueGateway, SyncProperties syncProperties) {
        this.venueGateway = venueGateway;
        this.syncProperties = syncProperties;
    }

    /** Never throws; venue errors become a FAILURE result. */
    public OrderResult execute(OrderJob job) {
        Instrument requested = job.getOrder().getInstrument();
        VenueOrder order = job.getOrder().getOrder();
        log.info(
                "Placing order: requestId={}, symbol={}, side={}, qty={}, type={}, price={}",
                job.getRequestId(),
                requested.getSymbol(),
                order.getSide(),
                order.getQuantity(),
                order.getType(),
                order.getLimitPrice());
        try {
            Optional<Instrument> qualified = venueGateway.qualifyInstrument(requested);
            if (qualified.isEmpty()) {
                log.warn(
                        "Order failed to qualify: requestId={}, symbol={}, exchange={}, currency={}",
                        job.getRequestId(),
                        requested.getSymbol(),
                        requested.getExchange(),
                        requested.getCurrency());
                return OrderResult.failure(
                        job.getRequestId(), ErrorCode.INSTRUMENT_NOT_FOUND, "Unable to qualify contract");
            }

            String orderId = venueGateway.placeOrder(qualified.get(), order);
            awaitInitialStatus(syncProperties.getOrderStatusWait());
            VenueOrderStatus status = venueGateway.getOrderStatus(orderId);

            log.info(
                    "Order placed: requestId={}, orderId={}, status={}, filled={}, remaining={}, avgFill={}",
                    job.getRequestId(),
                    orderId,
                    status.getStatus(),
                    status.getFilled(),
                    status.getRemaining(),
                    status.getAvgFillPrice());
            return OrderResult.builder()
                    .outcome(OrderOutcome.SUCCESS)
                    .requestId(job.getRequestId())
                    .orderId(orderId)
                    .status(status.getStatus())
                    .filled(status.getFilled())
                    .remaining(status.getRemaining())
                    .avgFillPrice(status.getAvgFillPrice())
                    .build();
        } catch (BaseException e) {
            log.error("Order error: requestId={}, code={}", job.getRequestId(), e.getErrorCode(), e);
            return OrderResult.failure(job.getRequestId(), e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Order error: requestId={}", job.getRequestId(), e);
            return OrderResult.failure(job.getRequestId(), ErrorCode.VENUE_ERROR, e.getMessage());
        }
    }

    private static void awaitInitialStatus(Duration wait) {
        if (wait.isZero() || wait.isNegative()) {
            return;
        }
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
