package in.spreadarb.infrastructure.exchange;

import in.spreadarb.domain.balance.AccountBalance;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.order.Order;
import in.spreadarb.domain.order.OrderRequest;
import in.spreadarb.domain.order.OrderSide;
import in.spreadarb.domain.order.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedExchangeClientTest {

    private SimulatedExchangeClient client;

    @BeforeEach
    void setUp() {
        client = new SimulatedExchangeClient("SIM_A", new BigDecimal("0.1"))
            .withQuote("BTC", "USDT", new BigDecimal("100.00"), new BigDecimal("100.05"),
                new BigDecimal("10"), new BigDecimal("1000000"))
            .withBalance("USDT", new BigDecimal("10000"))
            .withBalance("BTC", new BigDecimal("5"));
    }

    @Test
    @DisplayName("Ticker reflects the seeded quote")
    void tickerQuote() {
        Ticker ticker = client.getTicker("BTCUSDT").join();

        assertEquals("SIM_A", ticker.exchange());
        assertEquals(0, ticker.bid().compareTo(new BigDecimal("100.00")));
        assertEquals(0, ticker.ask().compareTo(new BigDecimal("100.05")));
        assertEquals(0, ticker.askQuantity().compareTo(BigDecimal.TEN));
    }

    @Test
    @DisplayName("Market buy fills at the ask and charges the taker fee in quote")
    void marketBuyFills() {
        Order order = client.placeOrder(
            OrderRequest.market("SIM_A", "BTCUSDT", OrderSide.BUY, BigDecimal.ONE)).join();

        assertEquals(OrderStatus.FILLED, order.status());
        assertEquals(0, order.averageFillPrice().compareTo(new BigDecimal("100.05")));
        assertEquals(0, order.fee().compareTo(new BigDecimal("0.10005")));
        assertEquals(0, client.balanceOf("BTC").compareTo(new BigDecimal("6")));
        assertEquals(0, client.balanceOf("USDT").compareTo(new BigDecimal("9899.84995")));
    }

    @Test
    @DisplayName("Fill ratio leaves the order partially filled and working")
    void partialFill() {
        client.setFillRatio(new BigDecimal("0.5"));

        Order order = client.placeOrder(
            OrderRequest.market("SIM_A", "BTCUSDT", OrderSide.SELL, BigDecimal.ONE)).join();

        assertEquals(OrderStatus.PARTIALLY_FILLED, order.status());
        assertEquals(0, order.filledQuantity().compareTo(new BigDecimal("0.5")));
        assertFalse(order.isTerminal());

        Order cancelled = client.cancelOrder("BTCUSDT", order.orderId()).join();
        assertEquals(OrderStatus.CANCELLED, cancelled.status());
        assertEquals(0, cancelled.filledQuantity().compareTo(new BigDecimal("0.5")), "Cancel keeps the partial fill");
    }

    @Test
    @DisplayName("Insufficient balance is rejected and nothing moves")
    void insufficientBalance() {
        CompletionException e = assertThrows(CompletionException.class, () -> client.placeOrder(
            OrderRequest.market("SIM_A", "BTCUSDT", OrderSide.SELL, new BigDecimal("6"))).join());

        assertTrue(e.getCause() instanceof OrderRejectedException);
        assertFalse(((ExchangeException) e.getCause()).isTransient());
        assertEquals(0, client.balanceOf("BTC").compareTo(new BigDecimal("5")));
    }

    @Test
    @DisplayName("Disconnected client fails with a transient error")
    void disconnected() {
        client.setConnected(false);

        assertFalse(client.testConnection().join());
        CompletionException e = assertThrows(CompletionException.class,
            () -> client.getTicker("BTCUSDT").join());
        assertTrue(e.getCause() instanceof ExchangeUnavailableException);
        assertTrue(ExchangeErrors.isTransient(e));
    }

    @Test
    @DisplayName("Resting orders fill only when filled by hand")
    void restingOrders() {
        client.setRestingOrders(true);
        Order order = client.placeOrder(
            OrderRequest.market("SIM_A", "BTCUSDT", OrderSide.BUY, new BigDecimal("0.1"))).join();
        assertEquals(OrderStatus.NEW, order.status());

        client.fillOrder(order.orderId());

        Order status = client.getOrderStatus("BTCUSDT", order.orderId()).join();
        assertEquals(OrderStatus.FILLED, status.status());
    }

    @Test
    @DisplayName("failNextTickers fails exactly that many requests")
    void tickerFaults() {
        client.failNextTickers(1);

        assertThrows(CompletionException.class, () -> client.getTicker("BTCUSDT").join());
        assertNotNull(client.getTicker("BTCUSDT").join());
    }

    @Test
    void balanceSnapshot() {
        AccountBalance balance = client.getBalance().join();

        assertEquals("SIM_A", balance.exchange());
        assertEquals(0, balance.available("USDT").compareTo(new BigDecimal("10000")));
        assertEquals(0, balance.available("ETH").signum());
    }
}
