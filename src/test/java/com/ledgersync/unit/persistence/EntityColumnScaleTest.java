package com.ledgersync.unit.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgersync.entity.PositionEntity;
import com.ledgersync.entity.PositionHistoryEntity;
import com.ledgersync.entity.TradeEntity;
import jakarta.persistence.Column;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Money columns must hold values at the cost-basis engine's scale so that stored realized,
 * commission and valuation amounts read back unchanged.
 */
class EntityColumnScaleTest {

    private static Column column(Class<?> type, String field) throws NoSuchFieldException {
        return type.getDeclaredField(field).getAnnotation(Column.class);
    }

    private static void assertLedgerScale(Column column) {
        assertThat(column).isNotNull();
        assertThat(column.scale()).isEqualTo(10);
        assertThat(column.precision()).isGreaterThanOrEqualTo(24);
    }

    @Test
    @DisplayName("Trade commission and realized PnL use scale 10")
    void tradeColumns() throws Exception {
        assertLedgerScale(column(TradeEntity.class, "commission"));
        assertLedgerScale(column(TradeEntity.class, "realizedPnl"));
    }

    @Test
    @DisplayName("Open position PnL columns use scale 10")
    void positionColumns() throws Exception {
        assertLedgerScale(column(PositionEntity.class, "realizedPnl"));
        assertLedgerScale(column(PositionEntity.class, "unrealizedPnl"));
        assertLedgerScale(column(PositionEntity.class, "dailyPnl"));
    }

    @Test
    @DisplayName("History realized PnL uses scale 10")
    void historyColumns() throws Exception {
        assertLedgerScale(column(PositionHistoryEntity.class, "realizedPnl"));
    }
}
