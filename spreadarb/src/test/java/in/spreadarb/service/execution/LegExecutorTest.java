package in.spreadarb.service.execution;

import in.spreadarb.domain.order.OrderSide;
import in.spreadarb.domain.order.OrderStatus;
import in.spreadarb.domain.strategy.AdvancedRules;
import in.spreadarb.infrastructure.exchange.SimulatedExchangeClient;
import in.spreadarb.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LegExecutorTest {

    private static AdvancedRules rules(boolean split, double maxChildQuote) {
        return new AdvancedRules(true, 0.1, 0.05, false, 0.02, 2, 20, true, 2, split, maxChildQuote, true);
    }

    @Test
    void testSmallLegIsNotSplit() {
        List<BigDecimal> slices = LegExecutor.slice(new BigDecimal("1"), new BigDecimal("100"), rules(true, 500));

        assertEquals(List.of(new BigDecimal("1")), slices);
    }

    @Test
    void testSplittingDisabled() {
        List<BigDecimal> slices = LegExecutor.slice(new BigDecimal("10"), new BigDecimal("100"), rules(false, 500));

        assertEquals(1, slices.size());
    }

    @Test
    void testLargeLegSplitWithRemainderInLastChild() {
        // 900 quote at 400 per child -> 3 children
        List<BigDecimal> slices = LegExecutor.slice(BigDecimal.ONE, new BigDecimal("900"), rules(true, 400));

        assertEquals(3, slices.size());
        assertEquals(0, slices.get(0).compareTo(new BigDecimal("0.33333333")));
        assertEquals(0, slices.get(1).compareTo(new BigDecimal("0.33333333")));
        assertEquals(0, slices.get(2).compareTo(new BigDecimal("0.33333334")));
        BigDecimal total = slices.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, total.compareTo(BigDecimal.ONE), "Children must add up to the leg quantity");
    }

    @Test
    void testSplitLegAggregatesChildOrders() {
        SimulatedExchangeClient exchange = Fixtures.exchange(Fixtures.EXCHANGE_A, "100.00", "100.05");

        LegOutcome outcome = new LegExecutor().execute(exchange,
            new LegExecutor.LegRequest("t-1", "BTCUSDT", OrderSide.BUY, new BigDecimal("3"), new BigDecimal("100.05")),
            rules(true, 120));

        assertEquals(3, outcome.childOrders());
        assertEquals(3, exchange.orders().size());
        assertTrue(outcome.isComplete(new BigDecimal("3")));
        assertEquals(OrderStatus.FILLED, outcome.order().status());
        assertEquals(0, outcome.order().averageFillPrice().compareTo(new BigDecimal("100.05")));
        assertNull(outcome.error());
    }

    @Test
    void testUnavailableExchangeRetriedThenGivesUp() {
        SimulatedExchangeClient exchange = Fixtures.exchange(Fixtures.EXCHANGE_A, "100.00", "100.05");
        exchange.setConnected(false);

        LegOutcome outcome = new LegExecutor().execute(exchange,
            new LegExecutor.LegRequest("t-2", "BTCUSDT", OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100.05")),
            rules(false, 500));

        assertNull(outcome.order());
        assertEquals(2, outcome.retries());
        assertNotNull(outcome.error());
        assertFalse(outcome.hasFill());
    }

    @Test
    void testRejectionIsNotRetried() {
        SimulatedExchangeClient exchange = Fixtures.exchange(Fixtures.EXCHANGE_A, "100.00", "100.05");
        exchange.rejectNextOrders(1);

        LegOutcome outcome = new LegExecutor().execute(exchange,
            new LegExecutor.LegRequest("t-3", "BTCUSDT", OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100.05")),
            rules(false, 500));

        assertNull(outcome.order());
        assertEquals(0, outcome.retries());
        assertTrue(exchange.orders().isEmpty());
    }

    @Test
    void testUnfilledRestingOrderCancelledAtTimeout() {
        SimulatedExchangeClient exchange = Fixtures.exchange(Fixtures.EXCHANGE_A, "100.00", "100.05");
        exchange.setRestingOrders(true);

        LegOutcome outcome = new LegExecutor().execute(exchange,
            new LegExecutor.LegRequest("t-4", "BTCUSDT", OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100.05")),
            new AdvancedRules(true, 0.1, 0.05, false, 0.02, 1, 20, true, 2, false, 500, true));

        assertNotNull(outcome.order());
        assertEquals(OrderStatus.CANCELLED, outcome.order().status());
        assertFalse(outcome.hasFill());
        assertNotNull(outcome.error());
    }

    @Test
    void testOrderLeftUnconfirmedWhenCancelAndStatusFail() throws Exception {
        SimulatedExchangeClient exchange = Fixtures.exchange(Fixtures.EXCHANGE_A, "100.00", "100.05");
        exchange.setRestingOrders(true);

        CompletableFuture<LegOutcome> running = CompletableFuture.supplyAsync(() -> new LegExecutor().execute(exchange,
            new LegExecutor.LegRequest("t-5", "BTCUSDT", OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100.05")),
            new AdvancedRules(true, 0.1, 0.05, false, 0.02, 1, 20, true, 2, false, 500, true)));
        long deadline = System.currentTimeMillis() + 5_000;
        while (exchange.orders().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(exchange.orders().isEmpty(), "Order placed");
        String orderId = exchange.orders().get(0).orderId();
        exchange.setConnected(false);

        LegOutcome outcome = running.get(10, TimeUnit.SECONDS);

        assertEquals(List.of(orderId), outcome.unsettledOrderIds());
        assertFalse(outcome.order().isTerminal());
        assertTrue(outcome.error().contains("may still be live"), outcome.error());
        assertEquals(OrderStatus.NEW, exchange.orders().get(0).status(), "Exchange never saw the cancel");
    }

    @Test
    void testSettledLegHasNoUnconfirmedOrders() {
        SimulatedExchangeClient exchange = Fixtures.exchange(Fixtures.EXCHANGE_A, "100.00", "100.05");

        LegOutcome outcome = new LegExecutor().execute(exchange,
            new LegExecutor.LegRequest("t-6", "BTCUSDT", OrderSide.BUY, BigDecimal.ONE, new BigDecimal("100.05")),
            rules(false, 500));

        assertFalse(outcome.hasUnsettledOrders());
    }
}
