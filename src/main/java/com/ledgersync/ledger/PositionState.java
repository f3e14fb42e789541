package com.ledgersync.ledger;

import com.ledgersync.domain.model.Position;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** The part of a position the cost-basis engine reads and writes. */
@Value
@Builder
public class PositionState {

    public static final PositionState FLAT = PositionState.builder()
            .quantity(BigDecimal.ZERO)
            .avgCost(BigDecimal.ZERO)
            .totalCost(BigDecimal.ZERO)
            .realizedPnl(BigDecimal.ZERO)
            .build();

    BigDecimal quantity;
    BigDecimal avgCost;
    BigDecimal totalCost;
    BigDecimal realizedPnl;

    public static PositionState of(Position position) {
        if (position == null) {
            return FLAT;
        }
        BigDecimal totalCost = position.getTotalCost() != null
                ? position.getTotalCost()
                : position.getAvgCost().multiply(position.getQuantity());
        return PositionState.builder()
                .quantity(position.getQuantity())
                .avgCost(position.getAvgCost())
                .totalCost(totalCost)
                .realizedPnl(position.getRealizedPnl() != null ? position.getRealizedPnl() : BigDecimal.ZERO)
                .build();
    }

    public PositionState withRealizedPnl(BigDecimal realized) {
        return PositionState.builder()
                .quantity(quantity)
                .avgCost(avgCost)
                .totalCost(totalCost)
                .realizedPnl(realized)
                .build();
    }

    public int direction() {
        return quantity.signum();
    }

    public boolean isFlat() {
        return quantity.signum() == 0;
    }
}
