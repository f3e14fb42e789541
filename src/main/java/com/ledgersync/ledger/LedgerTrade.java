package com.ledgersync.ledger;

import com.ledgersync.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A single execution as input to the cost-basis engine. quantity is unsigned. */
@Value
@Builder
public class LedgerTrade {

    OrderSide side;
    BigDecimal quantity;
    BigDecimal price;

    @Builder.Default
    BigDecimal commission = BigDecimal.ZERO;

    public BigDecimal signedQuantity() {
        return side.sign(quantity);
    }
}
