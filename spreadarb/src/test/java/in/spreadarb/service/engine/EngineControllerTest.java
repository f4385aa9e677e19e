package in.spreadarb.service.engine;

import in.spreadarb.application.port.input.EngineEventListener;
import in.spreadarb.config.EngineConfig;
import in.spreadarb.config.EngineSettings;
import in.spreadarb.config.PairSettings;
import in.spreadarb.config.PollingSettings;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.common.ErrorSeverity;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.pair.TradingPair;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.domain.trade.TradeResultStatus;
import in.spreadarb.infrastructure.exchange.ExchangeClientRegistry;
import in.spreadarb.infrastructure.exchange.SimulatedExchangeClient;
import in.spreadarb.infrastructure.history.InMemoryTradeHistory;
import in.spreadarb.infrastructure.metrics.ArbitrageMetrics;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.support.Fixtures;
import in.spreadarb.util.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static in.spreadarb.support.Fixtures.EXCHANGE_A;
import static in.spreadarb.support.Fixtures.EXCHANGE_B;
import static org.junit.jupiter.api.Assertions.*;

class EngineControllerTest {

    private SimulatedExchangeClient exchangeA;
    private SimulatedExchangeClient exchangeB;
    private ExchangeClientRegistry clients;
    private EngineEventBus events;
    private EngineController engine;

    private final List<EngineStatus> transitions = new CopyOnWriteArrayList<>();
    private final List<EmergencyCheck> emergencies = new CopyOnWriteArrayList<>();
    private final List<SpreadOpportunity> found = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        // Identical quotes: the polling loop never finds a tradeable spread on its own.
        exchangeA = Fixtures.exchange(EXCHANGE_A, "99.95", "100.05");
        exchangeB = Fixtures.exchange(EXCHANGE_B, "99.95", "100.05");
        clients = new ExchangeClientRegistry().register(exchangeA).register(exchangeB);

        events = EngineEventBus.direct();
        events.addListener(new EngineEventListener() {
            @Override
            public void onStatusChanged(EngineStatus previous, EngineStatus current) {
                transitions.add(current);
            }

            @Override
            public void onEmergencyTriggered(EmergencyCheck check) {
                emergencies.add(check);
            }

            @Override
            public void onOpportunityFound(SpreadOpportunity opportunity) {
                found.add(opportunity);
            }
        });
        engine = engine(true);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private EngineController engine(boolean tradingEnabled) {
        return engine(tradingEnabled, PollingSettings.defaults().intervalMs());
    }

    private EngineController engine(boolean tradingEnabled, long pollIntervalMs) {
        EngineConfig config = EngineConfig.defaults().withEngine(EngineSettings.defaults()
            .withTradingEnabled(tradingEnabled)
            .withShutdownGraceMs(1000))
            .withPolling(PollingSettings.defaults().withIntervalMs(pollIntervalMs));
        return new EngineController(config, clients, Fixtures.simpleStrategy(0.08), new InMemoryTradeHistory(),
            events, ArbitrageMetrics.NOOP, Clock.systemUTC());
    }

    /**
     * Quotes matching {@link Fixtures#opportunity(String)} with a fee that turns every trade into a loss.
     */
    private void losingMarket(String feePercent) {
        exchangeA.setQuote("BTCUSDT", new BigDecimal("100.00"), new BigDecimal("100.05"));
        exchangeB.setQuote("BTCUSDT", new BigDecimal("100.40"), new BigDecimal("100.45"));
        exchangeA.setFeePercent(new BigDecimal(feePercent));
        exchangeB.setFeePercent(new BigDecimal(feePercent));
    }

    private void awaitStatus(EngineStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (engine.status() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(expected, engine.status());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Start reaches RUNNING through STARTING")
    void startRuns() {
        assertEquals(EngineStatus.IDLE, engine.status());

        assertEquals(EngineStatus.RUNNING, engine.start().join());

        assertEquals(List.of(EngineStatus.STARTING, EngineStatus.RUNNING), transitions);
        assertNotNull(engine.balancePool().currentSnapshot(), "Pool is initialized before RUNNING");
    }

    @Test
    @DisplayName("Starting equity values held base assets at the opening prices")
    void startingEquityIncludesBaseAssets() {
        engine.start().join();

        // 2 x 100000 USDT plus 2 x 100 BTC at about 100 USDT
        BigDecimal starting = engine.balancePool().pnl().startingEquity();
        assertTrue(starting.compareTo(new BigDecimal("219000")) > 0, "Starting equity " + starting);
        assertTrue(starting.compareTo(new BigDecimal("221000")) < 0, "Starting equity " + starting);
        assertTrue(engine.balancePool().currentSnapshot().assets().get("BTC").priceInQuote().signum() > 0);
    }

    @Test
    @DisplayName("A second start returns the current status without restarting")
    void startIsIdempotent() {
        engine.start().join();

        assertEquals(EngineStatus.RUNNING, engine.start().join());
        assertEquals(2, transitions.size());
    }

    @Test
    @DisplayName("Pause and resume only move between RUNNING and PAUSED")
    void pauseAndResume() {
        assertEquals(EngineStatus.IDLE, engine.resume(), "Resume outside PAUSED is a no-op");
        assertEquals(EngineStatus.IDLE, engine.pause(), "Pause outside RUNNING is a no-op");

        engine.start().join();
        assertEquals(EngineStatus.PAUSED, engine.pause());
        assertEquals(EngineStatus.PAUSED, engine.pause());
        assertEquals(EngineStatus.RUNNING, engine.resume());
    }

    @Test
    @DisplayName("While paused, detected opportunities never reach an exchange")
    void pausedDiscardsDetections() throws InterruptedException {
        engine.close();
        engine = engine(true, 50);
        engine.start().join();
        assertEquals(EngineStatus.PAUSED, engine.pause());
        found.clear();

        exchangeA.setQuote("BTCUSDT", new BigDecimal("100.00"), new BigDecimal("100.05"));
        exchangeB.setQuote("BTCUSDT", new BigDecimal("100.40"), new BigDecimal("100.45"));
        long deadline = System.currentTimeMillis() + 5000;
        while (found.size() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertTrue(found.size() >= 3, "Polling kept detecting: " + found.size());
        assertTrue(found.get(0).shouldTrade());
        assertTrue(exchangeA.orders().isEmpty(), "No order on " + EXCHANGE_A);
        assertTrue(exchangeB.orders().isEmpty(), "No order on " + EXCHANGE_B);
        assertTrue(engine.getTradeHistory(10).isEmpty());
        assertEquals(EngineStatus.PAUSED, engine.status());
    }

    @Test
    @DisplayName("Stop drains through STOPPING and the engine can start again")
    void stopAndRestart() {
        engine.start().join();

        assertEquals(EngineStatus.STOPPED, engine.stop().join());
        assertTrue(transitions.contains(EngineStatus.STOPPING));
        assertEquals(EngineStatus.STOPPED, engine.stop().join(), "Stopping twice is harmless");

        assertEquals(EngineStatus.RUNNING, engine.start().join());
    }

    @Test
    @DisplayName("An unreachable exchange puts the engine in ERROR")
    void unreachableExchangeFailsStart() {
        exchangeB.setConnected(false);

        assertEquals(EngineStatus.ERROR, engine.start().join());

        EngineError error = engine.lastError().orElseThrow();
        assertTrue(error.message().contains("start failed"), error.message());

        exchangeB.setConnected(true);
        assertEquals(EngineStatus.RUNNING, engine.start().join(), "ERROR is left by starting again");
    }

    @Test
    @DisplayName("Cancelling the start token stops the engine")
    void cancelledTokenStops() throws InterruptedException {
        CancellationToken token = CancellationToken.create();
        engine.start(token).join();

        token.cancel();

        awaitStatus(EngineStatus.STOPPED);
    }

    @Test
    @DisplayName("Stop waits out the grace period and reports an execution still holding a leg")
    void stopReportsAbandonedExecution() throws InterruptedException {
        engine.start().join();
        exchangeA.setRestingOrders(true);

        CompletableFuture<TradeResult> pending = engine.executeArbitrage(Fixtures.opportunity("1"));
        long deadline = System.currentTimeMillis() + 5000;
        while (exchangeA.orders().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(exchangeA.orders().isEmpty(), "Buy leg submitted");

        assertEquals(EngineStatus.STOPPED, engine.stop().join());

        EngineError error = engine.lastError().orElseThrow();
        assertEquals(ErrorSeverity.CRITICAL, error.severity());
        assertTrue(error.message().contains("abandoned in state BUY_LEG_SUBMITTED"), error.message());
        assertFalse(pending.isDone());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PAIRS
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testPairRegistry() {
        TradingPair eth = TradingPair.fromSymbol("ETH/USDT", EXCHANGE_A, EXCHANGE_B, new BigDecimal("200"));

        engine.addTradingPair(eth);

        List<TradingPair> pairs = engine.getTradingPairs();
        assertEquals(2, pairs.size());
        assertEquals("BTC/USDT", pairs.get(0).symbol(), "Pairs are sorted by symbol");

        assertTrue(engine.setPairEnabled("ETH/USDT", false));
        assertFalse(engine.getTradingPairs().get(1).enabled());
        assertFalse(engine.setPairEnabled("XRP/USDT", true), "Unknown symbol");

        assertTrue(engine.removeTradingPair("ETH/USDT"));
        assertFalse(engine.removeTradingPair("ETH/USDT"));
        assertEquals(1, engine.getTradingPairs().size());
    }

    @Test
    void testPairOnUnknownExchangeRejected() {
        TradingPair pair = TradingPair.fromSymbol("BTC/USDT", EXCHANGE_A, "NOWHERE", new BigDecimal("500"));

        assertThrows(IllegalArgumentException.class, () -> engine.addTradingPair(pair));
        assertEquals(1, engine.getTradingPairs().size());
    }

    @Test
    @DisplayName("A configuration update registers new pairs and rejects invalid input")
    void updateConfigAddsPairs() {
        EngineConfig current = EngineConfig.defaults();
        List<PairSettings> pairs = new ArrayList<>(current.pairs());
        pairs.add(new PairSettings("ETH/USDT", EXCHANGE_A, EXCHANGE_B, new BigDecimal("200"), null, false));

        engine.updateConfig(new EngineConfig(current.engine(), current.polling(), current.balance(),
            current.emergency(), current.exchanges(), pairs));

        assertEquals(2, engine.getTradingPairs().size());
        assertFalse(engine.getTradingPairs().get(1).enabled());

        EngineConfig unknownExchange = new EngineConfig(current.engine(), current.polling(), current.balance(),
            current.emergency(), current.exchanges(),
            List.of(new PairSettings("BTC/USDT", EXCHANGE_A, "NOWHERE", new BigDecimal("500"), null, true)));
        assertThrows(IllegalArgumentException.class, () -> engine.updateConfig(unknownExchange));
        assertThrows(IllegalArgumentException.class, () -> engine.updateConfig(null));
    }

    @Test
    @DisplayName("A reloaded strategy decides the next analysis")
    void reloadStrategyAppliesToAnalysis() {
        engine.start().join();
        engine.pause();
        exchangeA.setQuote("BTCUSDT", new BigDecimal("100.00"), new BigDecimal("100.05"));
        exchangeB.setQuote("BTCUSDT", new BigDecimal("100.40"), new BigDecimal("100.45"));

        engine.reloadStrategy(Fixtures.simpleStrategy(1.0));
        SpreadOpportunity strict = engine.analyzeOpportunity(Fixtures.btcPair()).join();

        assertFalse(strict.shouldTrade(), "Net spread is below 1%");
        assertTrue(strict.netSpreadPercent().signum() > 0);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ON-DEMAND
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Analysis without market data yields a non-tradeable opportunity")
    void analyzeWithoutMarketData() {
        exchangeA.setConnected(false);

        SpreadOpportunity opportunity = engine.analyzeOpportunity(Fixtures.btcPair()).join();

        assertFalse(opportunity.shouldTrade());
        assertTrue(opportunity.rejectionReasons().get(0).startsWith("Market data unavailable"));
    }

    @Test
    @DisplayName("Executing an unknown pair returns ERROR")
    void executeUnknownPair() {
        SpreadOpportunity opportunity = Fixtures.opportunity("1");
        engine.removeTradingPair("BTC/USDT");

        TradeResult result = engine.executeArbitrage(opportunity).join();

        assertEquals(TradeResultStatus.ERROR, result.status());
        assertTrue(result.errorMessage().contains("BTC/USDT"));
    }

    @Test
    @DisplayName("Executing with trading disabled is cancelled and not recorded")
    void executeWithTradingDisabled() {
        engine.close();
        engine = engine(false);

        TradeResult result = engine.executeArbitrage(Fixtures.opportunity("1")).join();

        assertEquals(TradeResultStatus.CANCELLED, result.status());
        assertTrue(engine.getTradeHistory(10).isEmpty());
        assertEquals(0, engine.getTodayStats().totalTrades());
    }

    @Test
    @DisplayName("A manual execution lands in history and daily stats")
    void executeRecordsTrade() {
        engine.start().join();
        engine.pause();
        // Paused: the polling loop reports the spread but leaves execution to the caller.
        exchangeA.setQuote("BTCUSDT", new BigDecimal("100.00"), new BigDecimal("100.05"));
        exchangeB.setQuote("BTCUSDT", new BigDecimal("100.40"), new BigDecimal("100.45"));

        TradeResult result = engine.executeArbitrage(Fixtures.opportunity("1")).join();

        assertEquals(TradeResultStatus.SUCCESS, result.status());
        assertEquals(1, engine.getTradeHistory(10).size());
        assertEquals(1, engine.getTodayStats().totalTrades());
        assertEquals(1, engine.getTodayStats().successfulTrades());

        engine.resetDailyStats();
        assertEquals(0, engine.getTodayStats().totalTrades());
        assertEquals(1, engine.getTradeHistory(10).size(), "History survives a stats reset");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EMERGENCIES
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Three losing trades pause the engine until resumed")
    void lossStreakPauses() throws InterruptedException {
        losingMarket("1");
        engine.start().join();

        for (int i = 0; i < 3; i++) {
            TradeResult result = engine.executeArbitrage(Fixtures.opportunity("1")).join();
            assertTrue(result.isLoss(), "Fees exceed the spread");
        }

        awaitStatus(EngineStatus.PAUSED);
        assertEquals(EmergencyTriggerReason.CONSECUTIVE_LOSSES, emergencies.get(0).reason());

        assertEquals(EngineStatus.RUNNING, engine.resume());
    }

    @Test
    @DisplayName("An imbalance found while starting pauses the engine once it is running")
    void startupImbalancePauses() throws InterruptedException {
        exchangeB.withBalance("BTC", BigDecimal.ZERO);

        engine.start().join();

        awaitStatus(EngineStatus.PAUSED);
        assertEquals(EmergencyTriggerReason.CRITICAL_IMBALANCE, emergencies.get(emergencies.size() - 1).reason());
        assertTrue(exchangeA.orders().isEmpty() && exchangeB.orders().isEmpty(), "Nothing traded while imbalanced");
    }

    @Test
    @DisplayName("Exceeding the daily loss limit stops the engine")
    void dailyLossStops() throws InterruptedException {
        losingMarket("5");
        engine.start().join();

        TradeResult result = engine.executeArbitrage(Fixtures.opportunity("20")).join();
        assertTrue(result.netPnl().compareTo(new BigDecimal("-100")) < 0, "Loss " + result.netPnl());

        awaitStatus(EngineStatus.STOPPED);
        assertEquals(EmergencyTriggerReason.MAX_DAILY_LOSS_EXCEEDED, emergencies.get(0).reason());
    }
}
