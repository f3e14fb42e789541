package com.ledgersync.oms;

import com.ledgersync.domain.enums.OrderOutcome;
import com.ledgersync.exception.ErrorCode;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Answer to an order submission.
 *
 * <p>SUCCESS carries the venue order id and its first status. PENDING means the order is
 * still queued (or being placed) and will be processed; the request id identifies it.
 * FAILURE carries an error code and message.
 */
@Value
@Builder
public class OrderResult {

    public static final String STATUS_QUEUED = "queued";
    public static final String DISCONNECTED = "disconnected";

    OrderOutcome outcome;
    String requestId;
    String orderId;
    String status;
    BigDecimal filled;
    BigDecimal remaining;
    BigDecimal avgFillPrice;
    ErrorCode errorCode;
    String error;

    public static OrderResult pending(String requestId) {
        return OrderResult.builder()
                .outcome(OrderOutcome.PENDING)
                .requestId(requestId)
                .status(STATUS_QUEUED)
                .build();
    }

    public static OrderResult failure(String requestId, ErrorCode errorCode, String error) {
        return OrderResult.builder()
                .outcome(OrderOutcome.FAILURE)
                .requestId(requestId)
                .errorCode(errorCode)
                .error(error)
                .build();
    }

    public static OrderResult disconnected(String requestId) {
        return failure(requestId, ErrorCode.VENUE_DISCONNECTED, DISCONNECTED);
    }

    public boolean isSuccess() {
        return outcome == OrderOutcome.SUCCESS;
    }

    public boolean isPending() {
        return outcome == OrderOutcome.PENDING;
    }

    public boolean isFailure() {
        return outcome == OrderOutcome.FAILURE;
    }
}
