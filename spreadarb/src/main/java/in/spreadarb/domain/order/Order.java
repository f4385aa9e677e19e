package in.spreadarb.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Exchange view of an order. A new instance is produced for every fill update.
 *
 * Invariant: 0 <= filledQuantity <= quantity.
 */
public record Order(
    String orderId,             // exchange-assigned
    String clientOrderId,
    String exchange,
    String symbol,
    OrderSide side,
    OrderType type,
    BigDecimal quantity,
    BigDecimal price,
    OrderStatus status,
    BigDecimal filledQuantity,
    BigDecimal averageFillPrice,
    BigDecimal fee,             // in quote currency
    Instant updatedAt,
    String message
) {
    public Order {
        if (orderId == null || exchange == null || symbol == null || side == null || status == null) {
            throw new IllegalArgumentException("orderId, exchange, symbol, side and status are required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive");
        }
        if (filledQuantity == null) filledQuantity = BigDecimal.ZERO;
        if (averageFillPrice == null) averageFillPrice = BigDecimal.ZERO;
        if (fee == null) fee = BigDecimal.ZERO;
        if (updatedAt == null) updatedAt = Instant.now();
        if (filledQuantity.signum() < 0 || filledQuantity.compareTo(quantity) > 0) {
            throw new IllegalArgumentException(
                "filledQuantity " + filledQuantity + " outside [0, " + quantity + "] for order " + orderId);
        }
    }

    /**
     * Accepted order with no fills yet.
     */
    public static Order accepted(String orderId, OrderRequest request) {
        return new Order(orderId, request.clientOrderId(), request.exchange(), request.symbol(),
            request.side(), request.type(), request.quantity(), request.price(),
            OrderStatus.NEW, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, Instant.now(), null);
    }

    public Order withFill(OrderStatus newStatus, BigDecimal filled, BigDecimal avgPrice, BigDecimal totalFee) {
        return new Order(orderId, clientOrderId, exchange, symbol, side, type, quantity, price,
            newStatus, filled, avgPrice, totalFee, Instant.now(), message);
    }

    public Order withStatus(OrderStatus newStatus, String newMessage) {
        return new Order(orderId, clientOrderId, exchange, symbol, side, type, quantity, price,
            newStatus, filledQuantity, averageFillPrice, fee, Instant.now(), newMessage);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasFill() {
        return filledQuantity.signum() > 0;
    }

    public BigDecimal remainingQuantity() {
        return quantity.subtract(filledQuantity);
    }

    /**
     * Quote value of the filled part.
     */
    public BigDecimal filledValue() {
        return filledQuantity.multiply(averageFillPrice);
    }
}
