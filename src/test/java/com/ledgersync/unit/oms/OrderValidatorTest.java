package com.ledgersync.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.enums.OrderSide;
import com.ledgersync.domain.enums.OrderType;
import com.ledgersync.exception.ValidationException;
import com.ledgersync.oms.OrderRequest;
import com.ledgersync.oms.OrderValidator;
import com.ledgersync.oms.ValidatedOrder;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for OrderValidator covering required fields, order types and defaults. */
class OrderValidatorTest {

    private OrderValidator validator;

    @BeforeEach
    void setUp() {
        SyncProperties properties = new SyncProperties();
        properties.setBaseCurrency("USD");
        validator = new OrderValidator(properties);
    }

    private static OrderRequest request(String symbol, String qty, String side) {
        return OrderRequest.builder()
                .symbol(symbol)
                .quantity(qty != null ? new BigDecimal(qty) : null)
                .side(side)
                .build();
    }

    @Nested
    @DisplayName("Accepted orders")
    class Accepted {

        @Test
        @DisplayName("Market order gets normalized symbol and default routing")
        void marketDefaults() {
            ValidatedOrder order = validator.validate(request(" msft ", "5", "buy"));

            assertThat(order.getInstrument().getSymbol()).isEqualTo("MSFT");
            assertThat(order.getInstrument().getExchange()).isEqualTo("SMART");
            assertThat(order.getInstrument().getCurrency()).isEqualTo("USD");
            assertThat(order.getOrder().getSide()).isEqualTo(OrderSide.BUY);
            assertThat(order.getOrder().getType()).isEqualTo(OrderType.MARKET);
            assertThat(order.getOrder().getLimitPrice()).isNull();
        }

        @Test
        @DisplayName("Limit order keeps its price and explicit routing")
        void limitKeepsPrice() {
            OrderRequest request = request("AAPL", "1", "SELL");
            request.setOrderType("LMT");
            request.setPrice(new BigDecimal("187.25"));
            request.setExchange("nasdaq");
            request.setCurrency("usd");

            ValidatedOrder order = validator.validate(request);

            assertThat(order.getOrder().getType()).isEqualTo(OrderType.LIMIT);
            assertThat(order.getOrder().getLimitPrice()).isEqualByComparingTo("187.25");
            assertThat(order.getInstrument().getExchange()).isEqualTo("NASDAQ");
            assertThat(order.getInstrument().getCurrency()).isEqualTo("USD");
        }

        @Test
        @DisplayName("Price on a market order is ignored")
        void marketIgnoresPrice() {
            OrderRequest request = request("AAPL", "1", "BUY");
            request.setPrice(new BigDecimal("10"));

            assertThat(validator.validate(request).getOrder().getLimitPrice()).isNull();
        }
    }

    @Nested
    @DisplayName("Rejected orders")
    class Rejected {

        @Test
        @DisplayName("Missing symbol")
        void missingSymbol() {
            ValidationException e =
                    catchThrowableOfType(() -> validator.validate(request(" ", "1", "BUY")), ValidationException.class);

            assertThat(e).hasMessage("Symbol is required");
            assertThat(e.getDetails()).containsEntry("field", "symbol");
        }

        @Test
        @DisplayName("Non-positive quantity")
        void nonPositiveQuantity() {
            assertThatThrownBy(() -> validator.validate(request("AAPL", "-1", "BUY")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Quantity must be positive");
        }

        @Test
        @DisplayName("Unknown side")
        void unknownSide() {
            assertThatThrownBy(() -> validator.validate(request("AAPL", "1", "HOLD")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("HOLD");
        }

        @Test
        @DisplayName("Unknown order type")
        void unknownType() {
            OrderRequest request = request("AAPL", "1", "BUY");
            request.setOrderType("STOP");

            assertThatThrownBy(() -> validator.validate(request)).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Limit order without a price")
        void limitWithoutPrice() {
            OrderRequest request = request("AAPL", "1", "BUY");
            request.setOrderType("LIMIT");

            assertThatThrownBy(() -> validator.validate(request))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Limit price required");
        }
    }
}
