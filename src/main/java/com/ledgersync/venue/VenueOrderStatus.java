package com.ledgersync.venue;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VenueOrderStatus {

    String orderId;
    String status;
    BigDecimal filled;
    BigDecimal remaining;
    BigDecimal avgFillPrice;
}
