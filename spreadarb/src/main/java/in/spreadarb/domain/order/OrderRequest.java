package in.spreadarb.domain.order;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Order submission request.
 * Client order id is assigned by the engine so a retried submission can be correlated.
 */
public record OrderRequest(
    String clientOrderId,
    String exchange,
    String symbol,
    OrderSide side,
    OrderType type,
    BigDecimal quantity,
    BigDecimal price          // null for MARKET
) {
    public OrderRequest {
        if (clientOrderId == null || clientOrderId.isBlank()) {
            throw new IllegalArgumentException("clientOrderId cannot be blank");
        }
        if (exchange == null || symbol == null || side == null || type == null) {
            throw new IllegalArgumentException("exchange, symbol, side and type are required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        if (type == OrderType.LIMIT && (price == null || price.signum() <= 0)) {
            throw new IllegalArgumentException("LIMIT order requires a positive price");
        }
    }

    public static OrderRequest market(String exchange, String symbol, OrderSide side, BigDecimal quantity) {
        return new OrderRequest(newClientOrderId(), exchange, symbol, side, OrderType.MARKET, quantity, null);
    }

    public static OrderRequest limit(String exchange, String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
        return new OrderRequest(newClientOrderId(), exchange, symbol, side, OrderType.LIMIT, quantity, price);
    }

    private static String newClientOrderId() {
        return "arb-" + UUID.randomUUID().toString().replace("-", "").substring(0, 20);
    }
}
