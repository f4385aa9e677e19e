package in.spreadarb.application.port.output;

import in.spreadarb.domain.balance.AccountBalance;
import in.spreadarb.domain.market.OrderBook;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.order.Order;
import in.spreadarb.domain.order.OrderRequest;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

/**
 * Exchange connectivity used by the engine.
 *
 * All calls are asynchronous. Implementations fail the returned future with an
 * {@code ExchangeException} subtype:
 * - ExchangeUnavailableException for transient problems (timeouts, rate limits, connectivity)
 * - OrderRejectedException when the exchange refuses an order
 */
public interface ExchangeClient {

    // ═══════════════════════════════════════════════════════════════════════
    // IDENTITY
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Exchange name as used in configuration and trading pair legs.
     */
    String name();

    /**
     * Taker fee rate in percent (0.1 means 0.1%).
     */
    BigDecimal takerFeePercent();

    /**
     * Check that the exchange is reachable and credentials are accepted.
     */
    CompletableFuture<Boolean> testConnection();

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    CompletableFuture<Ticker> getTicker(String symbol);

    CompletableFuture<OrderBook> getOrderBook(String symbol, int depth);

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════════════

    CompletableFuture<AccountBalance> getBalance();

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Submit an order. Completes once the exchange has accepted (or filled) it.
     */
    CompletableFuture<Order> placeOrder(OrderRequest request);

    CompletableFuture<Order> getOrderStatus(String symbol, String orderId);

    /**
     * Cancel the working remainder of an order.
     * Completes with the order's final state, which may still carry a partial fill.
     */
    CompletableFuture<Order> cancelOrder(String symbol, String orderId);
}
