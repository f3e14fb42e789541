package com.ledgersync.oms;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.domain.enums.OrderSide;
import com.ledgersync.domain.enums.OrderType;
import com.ledgersync.domain.model.Instrument;
import com.ledgersync.exception.ValidationException;
import com.ledgersync.venue.VenueOrder;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Checks and normalizes an {@link OrderRequest} before it is queued. Anything rejected here
 * never reaches the venue.
 */
@Component
public class OrderValidator {

    static final String DEFAULT_EXCHANGE = "SMART";

    private final SyncProperties syncProperties;

    public OrderValidator(SyncProperties syncProperties) {
        this.syncProperties = syncProperties;
    }

    /**
     * @throws ValidationException with the offending field in its details
     */
    public ValidatedOrder validate(OrderRequest request) {
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            throw invalid("symbol", "Symbol is required");
        }
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw invalid("quantity", "Quantity must be positive");
        }
        OrderSide side = OrderSide.parse(request.getSide())
                .orElseThrow(() -> invalid("side", "Unknown side: " + request.getSide()));
        OrderType type = request.getOrderType() == null || request.getOrderType().isBlank()
                ? OrderType.MARKET
                : OrderType.parse(request.getOrderType())
                        .orElseThrow(() -> invalid("orderType", "Unknown order type: " + request.getOrderType()));

        BigDecimal limitPrice = null;
        if (type == OrderType.LIMIT) {
            if (request.getPrice() == null) {
                throw invalid("price", "Limit price required");
            }
            if (request.getPrice().signum() <= 0) {
                throw invalid("price", "Limit price must be positive");
            }
            limitPrice = request.getPrice();
        }

        Instrument instrument = Instrument.builder()
                .symbol(request.getSymbol().trim().toUpperCase(Locale.ROOT))
                .exchange(blankToDefault(request.getExchange(), DEFAULT_EXCHANGE))
                .currency(blankToDefault(request.getCurrency(), syncProperties.getBaseCurrency()))
                .build();
        VenueOrder order = VenueOrder.builder()
                .side(side)
                .type(type)
                .quantity(request.getQuantity())
                .limitPrice(limitPrice)
                .timeInForce(request.getTimeInForce())
                .account(request.getAccount())
                .build();
        return ValidatedOrder.builder().instrument(instrument).order(order).build();
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim().toUpperCase(Locale.ROOT);
    }

    private static ValidationException invalid(String field, String message) {
        return new ValidationException(message, Map.of("field", field));
    }
}
