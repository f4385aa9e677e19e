package in.spreadarb.domain.market;

import java.math.BigDecimal;

/**
 * One price level of an order book.
 */
public record OrderBookLevel(BigDecimal price, BigDecimal quantity) {
    public OrderBookLevel {
        if (price == null || quantity == null) {
            throw new IllegalArgumentException("price and quantity cannot be null");
        }
    }

    public BigDecimal notional() {
        return price.multiply(quantity);
    }
}
