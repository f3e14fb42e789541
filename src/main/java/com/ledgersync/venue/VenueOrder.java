package com.ledgersync.venue;

import com.ledgersync.domain.enums.OrderSide;
import com.ledgersync.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Order as handed to the venue. limitPrice is only set for LIMIT orders. */
@Value
@Builder
public class VenueOrder {

    OrderSide side;
    OrderType type;
    BigDecimal quantity;
    BigDecimal limitPrice;
    String timeInForce;
    String account;
}
