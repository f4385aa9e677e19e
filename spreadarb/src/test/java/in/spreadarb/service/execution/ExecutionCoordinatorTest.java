package in.spreadarb.service.execution;

import in.spreadarb.application.port.input.EngineEventListener;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.common.ErrorSeverity;
import in.spreadarb.domain.order.Order;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.domain.trade.ExecutionState;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.domain.trade.TradeResultStatus;
import in.spreadarb.infrastructure.exchange.ExchangeClientRegistry;
import in.spreadarb.infrastructure.exchange.SimulatedExchangeClient;
import in.spreadarb.infrastructure.metrics.ArbitrageMetrics;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.service.market.LatestTickerTable;
import in.spreadarb.service.opportunity.StrategyEvaluator;
import in.spreadarb.support.Fixtures;
import in.spreadarb.util.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static in.spreadarb.support.Fixtures.EXCHANGE_A;
import static in.spreadarb.support.Fixtures.EXCHANGE_B;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ExecutionCoordinatorTest {

    @Mock
    private ArbitrageMetrics metrics;

    private SimulatedExchangeClient exchangeA;
    private SimulatedExchangeClient exchangeB;
    private StrandedPositionMonitor stranded;
    private ExecutorService pool;
    private final List<EngineError> errors = new CopyOnWriteArrayList<>();
    private volatile boolean tradingEnabled = true;
    private volatile TradingStrategy strategy;
    private ExecutionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        exchangeA = Fixtures.exchange(EXCHANGE_A, "100.00", "100.05");
        exchangeB = Fixtures.exchange(EXCHANGE_B, "100.40", "100.45");
        ExchangeClientRegistry clients = new ExchangeClientRegistry().register(exchangeA).register(exchangeB);

        strategy = withOrderTimeout(5);
        StrategyEvaluator strategies = new StrategyEvaluator(strategy);

        EngineEventBus events = EngineEventBus.direct();
        events.addListener(new EngineEventListener() {
            @Override
            public void onError(EngineError error) {
                errors.add(error);
            }
        });
        stranded = new StrandedPositionMonitor(new LatestTickerTable(), events, strategies);
        pool = Executors.newFixedThreadPool(2);
        coordinator = new ExecutionCoordinator(clients, events, metrics, stranded, pool,
            () -> strategy, () -> tradingEnabled);
    }

    private static TradingStrategy withOrderTimeout(int seconds) {
        TradingStrategy base = Fixtures.simpleStrategy(0.08);
        return base.withAdvanced(base.advanced().withOrderTiming(seconds, 20));
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private TradeResult run(String quantity) throws Exception {
        return coordinator.execute(Fixtures.opportunity(quantity), Fixtures.btcPair(), CancellationToken.create())
            .get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Both legs fill: SUCCESS with fees netted out")
    void bothLegsFill() throws Exception {
        TradeResult result = run("1");

        assertEquals(TradeResultStatus.SUCCESS, result.status());
        assertEquals(ExecutionState.COMPLETED, result.executionState());
        assertEquals(0, result.sellOrder().quantity().compareTo(result.buyOrder().filledQuantity()));
        // 100.40 - 100.05 - 0.10005 - 0.1004
        assertEquals(0, result.netPnl().compareTo(new BigDecimal("0.14955")), "net was " + result.netPnl());
        assertTrue(result.isWin());
        assertFalse(coordinator.isBusy("BTC/USDT"));
        assertTrue(errors.isEmpty());
    }

    @Test
    @DisplayName("Half-filled buy sells exactly the filled half")
    void partialBuySellsFilledQuantity() throws Exception {
        strategy = withOrderTimeout(1);
        exchangeA.setFillRatio(new BigDecimal("0.5"));

        TradeResult result = run("1");

        assertEquals(TradeResultStatus.PARTIAL_SUCCESS, result.status());
        assertEquals(0, result.buyOrder().filledQuantity().compareTo(new BigDecimal("0.5")));
        assertEquals(0, result.sellOrder().quantity().compareTo(new BigDecimal("0.5")));
        assertEquals(0, result.sellOrder().filledQuantity().compareTo(new BigDecimal("0.5")));
        assertEquals(0, exchangeA.balanceOf("BTC").compareTo(new BigDecimal("100.5")), "Buy remainder was cancelled");
    }

    @Test
    @DisplayName("Rejected buy ends the attempt without a sell")
    void buyRejected() throws Exception {
        exchangeA.rejectNextOrders(1);

        TradeResult result = run("1");

        assertEquals(TradeResultStatus.BUY_LEG_FAILED, result.status());
        assertEquals(ExecutionState.FAILED, result.executionState());
        assertNull(result.sellOrder());
        assertTrue(exchangeB.orders().isEmpty(), "No sell may be placed");
        assertEquals(ErrorSeverity.MEDIUM, errors.get(0).severity());
    }

    @Test
    @DisplayName("A buy whose cancel and status check both fail is reported HIGH with its order id")
    void unconfirmedBuyReportedHigh() throws Exception {
        strategy = withOrderTimeout(1);
        exchangeA.setRestingOrders(true);
        CompletableFuture<TradeResult> pending =
            coordinator.execute(Fixtures.opportunity("1"), Fixtures.btcPair(), CancellationToken.create());
        String orderId = awaitOrder(exchangeA).orderId();

        exchangeA.setConnected(false);
        TradeResult result = pending.get(10, TimeUnit.SECONDS);

        assertEquals(TradeResultStatus.BUY_LEG_FAILED, result.status());
        assertTrue(exchangeB.orders().isEmpty(), "No sell may be placed");
        EngineError error = errors.get(errors.size() - 1);
        assertEquals(ErrorSeverity.HIGH, error.severity());
        assertTrue(error.message().contains(orderId), error.message());
        assertNotNull(error.recommendedAction());
        assertTrue(error.recommendedAction().contains(orderId), error.recommendedAction());
        assertFalse(coordinator.isBusy("BTC/USDT"));
    }

    @Test
    @DisplayName("Failed sell leaves held inventory and raises a CRITICAL error")
    void sellRejectedLeavesInventory() throws Exception {
        exchangeB.rejectNextOrders(1);

        TradeResult result = run("1");

        assertEquals(TradeResultStatus.SELL_LEG_FAILED, result.status());
        assertEquals(ExecutionState.PARTIAL_FAILURE, result.executionState());
        assertNotNull(result.heldInventory());
        assertEquals(EXCHANGE_A, result.heldInventory().exchange());
        assertEquals(0, result.heldInventory().quantity().compareTo(BigDecimal.ONE));
        assertEquals(1, stranded.count());

        EngineError critical = errors.get(errors.size() - 1);
        assertEquals(ErrorSeverity.CRITICAL, critical.severity());
        assertNotNull(critical.recommendedAction());
        assertEquals(result.heldInventory(), critical.heldInventory());
    }

    @Test
    @DisplayName("Only one execution per pair at a time")
    void onePerPair() throws Exception {
        exchangeA.setRestingOrders(true);

        Optional<CompletableFuture<TradeResult>> first =
            coordinator.tryExecute(Fixtures.opportunity("1"), Fixtures.btcPair(), CancellationToken.create());
        Optional<CompletableFuture<TradeResult>> second =
            coordinator.tryExecute(Fixtures.opportunity("1"), Fixtures.btcPair(), CancellationToken.create());

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty(), "Second attempt must be dropped while the first is in flight");
        assertTrue(coordinator.isBusy("BTC/USDT"));
        verify(metrics).recordExecutionSkipped("BTC/USDT", "pair_busy");

        Order resting = awaitOrder(exchangeA);
        exchangeA.fillOrder(resting.orderId());

        TradeResult result = first.get().get(10, TimeUnit.SECONDS);
        assertEquals(TradeResultStatus.SUCCESS, result.status());
        assertFalse(coordinator.isBusy("BTC/USDT"));
    }

    @Test
    @DisplayName("Concurrent triggers for one pair start exactly one execution")
    void concurrentTriggersOnePerPair() throws Exception {
        exchangeA.setRestingOrders(true);
        int callers = 8;
        ExecutorService triggers = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Optional<CompletableFuture<TradeResult>>>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                attempts.add(triggers.submit(() -> {
                    ready.countDown();
                    go.await();
                    return coordinator.tryExecute(Fixtures.opportunity("1"), Fixtures.btcPair(),
                        CancellationToken.create());
                }));
            }
            assertTrue(ready.await(5, TimeUnit.SECONDS));
            go.countDown();

            List<CompletableFuture<TradeResult>> started = new ArrayList<>();
            for (Future<Optional<CompletableFuture<TradeResult>>> attempt : attempts) {
                attempt.get(5, TimeUnit.SECONDS).ifPresent(started::add);
            }

            assertEquals(1, started.size(), "Exactly one trigger may win the pair");
            verify(metrics, times(callers - 1)).recordExecutionSkipped("BTC/USDT", "pair_busy");

            exchangeA.fillOrder(awaitOrder(exchangeA).orderId());
            assertEquals(TradeResultStatus.SUCCESS, started.get(0).get(10, TimeUnit.SECONDS).status());
            assertEquals(1, exchangeA.orders().size(), "Only one buy leg reached the exchange");
        } finally {
            triggers.shutdownNow();
        }
    }

    @Test
    @DisplayName("Busy pair yields CANCELLED from execute()")
    void executeOnBusyPair() throws Exception {
        exchangeA.setRestingOrders(true);
        CompletableFuture<TradeResult> first =
            coordinator.execute(Fixtures.opportunity("1"), Fixtures.btcPair(), CancellationToken.create());

        TradeResult second = run("1");

        assertEquals(TradeResultStatus.CANCELLED, second.status());
        exchangeA.fillOrder(awaitOrder(exchangeA).orderId());
        assertEquals(TradeResultStatus.SUCCESS, first.get(10, TimeUnit.SECONDS).status());
    }

    @Test
    @DisplayName("Trading disabled cancels without touching the exchanges")
    void tradingDisabled() throws Exception {
        tradingEnabled = false;

        TradeResult result = run("1");

        assertEquals(TradeResultStatus.CANCELLED, result.status());
        assertEquals("Trading disabled", result.errorMessage());
        assertTrue(exchangeA.orders().isEmpty());
    }

    @Test
    @DisplayName("Cancelled run token cancels before the buy")
    void cancelledToken() throws Exception {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        TradeResult result = coordinator.execute(Fixtures.opportunity("1"), Fixtures.btcPair(), token)
            .get(10, TimeUnit.SECONDS);

        assertEquals(TradeResultStatus.CANCELLED, result.status());
        assertEquals("Engine stopping", result.errorMessage());
    }

    @Test
    @DisplayName("awaitInFlight reports executions still running after the grace period")
    void abandonedAfterGrace() throws Exception {
        exchangeA.setRestingOrders(true);
        CompletableFuture<TradeResult> pending =
            coordinator.execute(Fixtures.opportunity("1"), Fixtures.btcPair(), CancellationToken.create());
        Order resting = awaitOrder(exchangeA);

        List<ExecutionHandle> abandoned = coordinator.awaitInFlight(Duration.ofMillis(100));

        assertEquals(1, abandoned.size());
        assertEquals(ExecutionState.BUY_LEG_SUBMITTED, abandoned.get(0).state());

        exchangeA.fillOrder(resting.orderId());
        pending.get(10, TimeUnit.SECONDS);
        assertTrue(coordinator.awaitInFlight(Duration.ofMillis(100)).isEmpty());
    }

    private static Order awaitOrder(SimulatedExchangeClient exchange) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (exchange.orders().isEmpty()) {
            if (System.currentTimeMillis() > deadline) {
                fail("No order reached " + exchange.name());
            }
            Thread.sleep(10);
        }
        return exchange.orders().get(0);
    }
}
