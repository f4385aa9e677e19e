package in.spreadarb.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class OrderTest {

    private static OrderRequest buy(String qty) {
        return OrderRequest.market("SIM_A", "BTCUSDT", OrderSide.BUY, new BigDecimal(qty));
    }

    @Test
    @DisplayName("Accepted order starts unfilled and non-terminal")
    void acceptedOrder() {
        OrderRequest request = buy("0.5");

        Order order = Order.accepted("o-1", request);

        assertEquals(OrderStatus.NEW, order.status());
        assertEquals(request.clientOrderId(), order.clientOrderId());
        assertFalse(order.hasFill());
        assertFalse(order.isTerminal());
        assertEquals(0, order.remainingQuantity().compareTo(new BigDecimal("0.5")));
    }

    @Test
    @DisplayName("Filled quantity may not exceed order quantity")
    void fillBoundedByQuantity() {
        Order order = Order.accepted("o-1", buy("0.5"));

        assertThrows(IllegalArgumentException.class,
            () -> order.withFill(OrderStatus.FILLED, new BigDecimal("0.6"), new BigDecimal("100"), BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> order.withFill(OrderStatus.FILLED, new BigDecimal("-0.1"), new BigDecimal("100"), BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Partial fill reports remaining quantity and filled value")
    void partialFill() {
        Order order = Order.accepted("o-1", buy("1"))
            .withFill(OrderStatus.PARTIALLY_FILLED, new BigDecimal("0.25"), new BigDecimal("100"), new BigDecimal("0.025"));

        assertTrue(order.hasFill());
        assertEquals(0, order.remainingQuantity().compareTo(new BigDecimal("0.75")));
        assertEquals(0, order.filledValue().compareTo(new BigDecimal("25")));
    }

    @Test
    @DisplayName("LIMIT requests need a positive price")
    void limitNeedsPrice() {
        assertThrows(IllegalArgumentException.class,
            () -> OrderRequest.limit("SIM_A", "BTCUSDT", OrderSide.SELL, BigDecimal.ONE, null));
        assertThrows(IllegalArgumentException.class,
            () -> OrderRequest.market("SIM_A", "BTCUSDT", OrderSide.SELL, BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Terminal statuses")
    void terminalStatuses() {
        assertTrue(OrderStatus.FILLED.isTerminal());
        assertTrue(OrderStatus.CANCELLED.isTerminal());
        assertTrue(OrderStatus.REJECTED.isTerminal());
        assertFalse(OrderStatus.NEW.isTerminal());
        assertFalse(OrderStatus.PARTIALLY_FILLED.isTerminal());
    }
}
