package in.spreadarb.infrastructure.exchange;

import in.spreadarb.domain.order.OrderRequest;

/**
 * The exchange refused an order (insufficient balance, invalid size, unknown symbol).
 */
public class OrderRejectedException extends ExchangeException {

    private final OrderRequest orderRequest;

    public OrderRejectedException(String exchange, OrderRequest orderRequest, String reason) {
        super(exchange, String.format("Order %s %s %s rejected: %s",
            orderRequest.side(), orderRequest.quantity(), orderRequest.symbol(), reason));
        this.orderRequest = orderRequest;
    }

    public OrderRequest getOrderRequest() {
        return orderRequest;
    }
}
