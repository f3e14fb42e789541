package com.ledgersync.ledger;

import com.ledgersync.domain.enums.TradeAction;
import com.ledgersync.exception.InvalidTradeException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Average-cost accounting for a single position.
 *
 * <p>Pure function of (current state, trade): no I/O, no shared state. The rules:
 * <ul>
 *   <li><b>Open / add</b> (flat, or trade in the position's direction): the trade's signed
 *       notional plus its commission is added to the cost basis and the average cost is
 *       recomputed. Nothing is realized.</li>
 *   <li><b>Close</b> (opposite direction): {@code min(|trade|, |position|)} units close at
 *       the trade price against the unchanged average cost. The commission is split pro rata
 *       between the closing and opening quantities and the closing share is deducted from
 *       the realized amount.</li>
 *   <li>A close that lands exactly on zero archives the position. One that overshoots flips
 *       it: the old position is archived and the remainder opens a new one at the trade
 *       price, carrying the opening share of commission.</li>
 * </ul>
 *
 * <p>Amounts are {@link BigDecimal}. Divisions (average cost, commission split) are carried
 * to {@value #SCALE} decimal places with {@link RoundingMode#HALF_EVEN}.
 */
@Component
public class CostBasisEngine {

    static final int SCALE = 10;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    /**
     * Applies one trade to a position.
     *
     * @param current the position before the trade, {@link PositionState#FLAT} if none
     * @throws InvalidTradeException if the trade quantity or price is zero
     */
    public LedgerResult apply(PositionState current, LedgerTrade trade) {
        validate(trade);
        PositionState state = current != null ? current : PositionState.FLAT;
        BigDecimal signedQty = trade.signedQuantity();

        if (state.isFlat()) {
            return open(trade, signedQty);
        }
        if (state.direction() == signedQty.signum()) {
            return add(state, trade, signedQty);
        }
        return close(state, trade, signedQty);
    }

    private LedgerResult open(LedgerTrade trade, BigDecimal signedQty) {
        BigDecimal totalCost = signedQty.multiply(trade.getPrice()).add(trade.getCommission());
        PositionState opened = PositionState.builder()
                .quantity(signedQty)
                .avgCost(divide(totalCost, signedQty))
                .totalCost(totalCost)
                .realizedPnl(BigDecimal.ZERO)
                .build();
        return LedgerResult.builder()
                .action(TradeAction.OPEN)
                .position(opened)
                .realizedPnl(BigDecimal.ZERO)
                .legs(List.of(leg(signedQty.abs(), trade.getCommission(), BigDecimal.ZERO, false)))
                .build();
    }

    private LedgerResult add(PositionState state, LedgerTrade trade, BigDecimal signedQty) {
        BigDecimal totalCost = state.getTotalCost()
                .add(signedQty.multiply(trade.getPrice()))
                .add(trade.getCommission());
        BigDecimal quantity = state.getQuantity().add(signedQty);
        PositionState added = PositionState.builder()
                .quantity(quantity)
                .avgCost(divide(totalCost, quantity))
                .totalCost(totalCost)
                .realizedPnl(state.getRealizedPnl())
                .build();
        return LedgerResult.builder()
                .action(TradeAction.ADD)
                .position(added)
                .realizedPnl(BigDecimal.ZERO)
                .legs(List.of(leg(signedQty.abs(), trade.getCommission(), BigDecimal.ZERO, false)))
                .build();
    }

    private LedgerResult close(PositionState state, LedgerTrade trade, BigDecimal signedQty) {
        BigDecimal tradeQty = signedQty.abs();
        BigDecimal closeQty = tradeQty.min(state.getQuantity().abs());
        BigDecimal commissionClose = closeQty.compareTo(tradeQty) == 0
                ? trade.getCommission()
                : divide(trade.getCommission().multiply(closeQty), tradeQty);
        BigDecimal commissionOpen = trade.getCommission().subtract(commissionClose);

        BigDecimal priceMove = state.direction() > 0
                ? trade.getPrice().subtract(state.getAvgCost())
                : state.getAvgCost().subtract(trade.getPrice());
        BigDecimal realized = priceMove.multiply(closeQty).subtract(commissionClose);
        BigDecimal realizedTotal = state.getRealizedPnl().add(realized);
        BigDecimal remaining = state.getQuantity().add(signedQty);

        if (remaining.signum() == 0) {
            PositionState closed = state.withRealizedPnl(realizedTotal);
            return LedgerResult.builder()
                    .action(TradeAction.FULL_CLOSE)
                    .position(closed)
                    .realizedPnl(realized)
                    .legs(List.of(leg(closeQty, commissionClose, realized, false)))
                    .build();
        }

        if (remaining.signum() == state.direction()) {
            PositionState reduced = PositionState.builder()
                    .quantity(remaining)
                    .avgCost(state.getAvgCost())
                    .totalCost(state.getAvgCost().multiply(remaining))
                    .realizedPnl(realizedTotal)
                    .build();
            return LedgerResult.builder()
                    .action(TradeAction.PARTIAL_CLOSE)
                    .position(reduced)
                    .realizedPnl(realized)
                    .legs(List.of(leg(closeQty, commissionClose, realized, false)))
                    .build();
        }

        BigDecimal openTotalCost = remaining.multiply(trade.getPrice()).add(commissionOpen);
        PositionState opened = PositionState.builder()
                .quantity(remaining)
                .avgCost(divide(openTotalCost, remaining))
                .totalCost(openTotalCost)
                .realizedPnl(BigDecimal.ZERO)
                .build();
        return LedgerResult.builder()
                .action(TradeAction.FLIP)
                .position(state.withRealizedPnl(realizedTotal))
                .openedPosition(opened)
                .realizedPnl(realized)
                .legs(List.of(
                        leg(closeQty, commissionClose, realized, false),
                        leg(remaining.abs(), commissionOpen, BigDecimal.ZERO, true)))
                .build();
    }

    private void validate(LedgerTrade trade) {
        if (trade.getSide() == null || trade.getQuantity() == null || trade.getQuantity().signum() == 0) {
            throw new InvalidTradeException(
                    "Trade quantity must be non-zero", Map.of("quantity", String.valueOf(trade.getQuantity())));
        }
        if (trade.getPrice() == null || trade.getPrice().signum() == 0) {
            throw new InvalidTradeException(
                    "Trade price must be non-zero", Map.of("price", String.valueOf(trade.getPrice())));
        }
    }

    private static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, SCALE, ROUNDING);
    }

    private static TradeLeg leg(BigDecimal quantity, BigDecimal commission, BigDecimal realized, boolean opening) {
        return TradeLeg.builder()
                .quantity(quantity)
                .commission(commission)
                .realizedPnl(realized)
                .opening(opening)
                .build();
    }
}
