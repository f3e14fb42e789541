package com.ledgersync.unit.venue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.ledgersync.config.VenueConfig;
import com.ledgersync.domain.enums.OrderSide;
import com.ledgersync.domain.enums.OrderType;
import com.ledgersync.domain.model.Instrument;
import com.ledgersync.exception.VenueException;
import com.ledgersync.ledger.CostBasisEngine;
import com.ledgersync.venue.VenueEventListener;
import com.ledgersync.venue.VenueOrder;
import com.ledgersync.venue.event.ExecutionEvent;
import com.ledgersync.venue.event.PositionPnLEvent;
import com.ledgersync.venue.event.PositionSnapshotEvent;
import com.ledgersync.venue.simulator.SimulatedVenueGateway;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

/**
 * Unit tests for SimulatedVenueGateway: immediate fills, the event sequence per fill,
 * execution replay, position list and live valuations.
 */
class SimulatedVenueGatewayTest {

    private static final Instant NOW = Instant.parse("2024-03-15T15:00:00Z");

    private SimulatedVenueGateway gateway;
    private VenueEventListener listener;

    @BeforeEach
    void setUp() {
        VenueConfig.Simulator settings = new VenueConfig.Simulator();
        settings.setAccount("SIM-1");
        settings.setCommissionPerShare(new BigDecimal("0.01"));
        settings.setMinCommission(BigDecimal.ONE);
        gateway = new SimulatedVenueGateway(settings, new CostBasisEngine(), Clock.fixed(NOW, ZoneOffset.UTC));
        listener = mock(VenueEventListener.class);
        gateway.connect();
    }

    private Instrument qualify(String symbol) {
        return gateway.qualifyInstrument(Instrument.builder()
                        .symbol(symbol)
                        .exchange("SMART")
                        .currency("USD")
                        .build())
                .orElseThrow();
    }

    private static VenueOrder market(OrderSide side, String qty) {
        return VenueOrder.builder()
                .side(side)
                .type(OrderType.MARKET)
                .quantity(new BigDecimal(qty))
                .build();
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("Qualification assigns a stable contract id per symbol")
        void stableContractIds() {
            Instrument first = qualify("aapl");
            Instrument second = qualify("AAPL");

            assertThat(first.getSymbol()).isEqualTo("AAPL");
            assertThat(first.getContractId()).isNotNull().isEqualTo(second.getContractId());
            assertThat(qualify("MSFT").getContractId()).isNotEqualTo(first.getContractId());
        }

        @Test
        @DisplayName("Market order fills at the mark and reports Filled")
        void marketFillsAtMark() {
            gateway.setMarkPrice("AAPL", new BigDecimal("187.5"));

            String orderId = gateway.placeOrder(qualify("AAPL"), market(OrderSide.BUY, "10"));

            assertThat(gateway.getOrderStatus(orderId).getStatus()).isEqualTo("Filled");
            assertThat(gateway.getOrderStatus(orderId).getAvgFillPrice()).isEqualByComparingTo("187.5");
            assertThat(gateway.getOrderStatus(orderId).getRemaining()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Limit order fills at its limit price")
        void limitFillsAtLimit() {
            VenueOrder order = VenueOrder.builder()
                    .side(OrderSide.SELL)
                    .type(OrderType.LIMIT)
                    .quantity(BigDecimal.ONE)
                    .limitPrice(new BigDecimal("99.5"))
                    .build();

            String orderId = gateway.placeOrder(qualify("AAPL"), order);

            assertThat(gateway.getOrderStatus(orderId).getAvgFillPrice()).isEqualByComparingTo("99.5");
        }

        @Test
        @DisplayName("Calls fail once disconnected")
        void disconnectedFails() {
            gateway.disconnect();

            assertThat(gateway.isConnected()).isFalse();
            assertThatThrownBy(() -> gateway.requestExecutions()).isInstanceOf(VenueException.class);
            assertThatThrownBy(() -> gateway.pumpEvents(listener, Duration.ZERO)).isInstanceOf(VenueException.class);
        }
    }

    @Nested
    @DisplayName("Event stream")
    class EventStream {

        @Test
        @DisplayName("A fill emits execution, commission report and position snapshot in order")
        void fillEventSequence() throws InterruptedException {
            gateway.placeOrder(qualify("AAPL"), market(OrderSide.BUY, "10"));

            gateway.pumpEvents(listener, Duration.ZERO);

            InOrder order = inOrder(listener);
            ArgumentCaptor<ExecutionEvent> execution = ArgumentCaptor.forClass(ExecutionEvent.class);
            order.verify(listener).onExecution(execution.capture());
            order.verify(listener).onCommissionReport(any());
            order.verify(listener).onPositionSnapshot(any());
            assertThat(execution.getValue().getSide()).isEqualTo("BOT");
            assertThat(execution.getValue().getAccount()).isEqualTo("SIM-1");
            assertThat(execution.getValue().getTime()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Replay returns executions with their commission attached")
        void replayCarriesCommission() {
            gateway.placeOrder(qualify("AAPL"), market(OrderSide.BUY, "10"));

            List<ExecutionEvent> executions = gateway.requestExecutions();

            assertThat(executions).hasSize(1);
            assertThat(executions.get(0).getCommissionReport().getCommission()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Closed positions drop out of the position list")
        void closedPositionsDropOut() {
            Instrument aapl = qualify("AAPL");
            gateway.placeOrder(aapl, market(OrderSide.BUY, "10"));
            gateway.placeOrder(qualify("MSFT"), market(OrderSide.BUY, "1"));
            gateway.placeOrder(aapl, market(OrderSide.SELL, "10"));

            List<PositionSnapshotEvent> positions = gateway.requestPositions("SIM-1");

            assertThat(positions).extracting(PositionSnapshotEvent::getSymbol).containsExactly("MSFT");
        }

        @Test
        @DisplayName("Valuations are published only for subscribed contracts")
        void valuationsForSubscribedOnly() throws InterruptedException {
            Instrument aapl = qualify("AAPL");
            gateway.placeOrder(aapl, market(OrderSide.BUY, "10"));
            gateway.pumpEvents(listener, Duration.ZERO);
            verify(listener, never()).onPositionPnL(any());

            gateway.subscribePositionPnL("SIM-1", aapl.getContractId());
            gateway.setMarkPrice("AAPL", new BigDecimal("110"));
            gateway.pumpEvents(listener, Duration.ZERO);

            ArgumentCaptor<PositionPnLEvent> valuation = ArgumentCaptor.forClass(PositionPnLEvent.class);
            verify(listener).onPositionPnL(valuation.capture());
            assertThat(valuation.getValue().getContractId()).isEqualTo(aapl.getContractId());
            assertThat(valuation.getValue().getUnrealizedPnl()).isEqualTo(99.0);
        }
    }
}
