package in.spreadarb.service.engine;

import in.spreadarb.application.port.input.ArbitrageEngine;
import in.spreadarb.application.port.input.BalancePoolService;
import in.spreadarb.application.port.input.EngineEventListener;
import in.spreadarb.application.port.output.ExchangeClientFactory;
import in.spreadarb.application.port.output.TradeHistoryRecorder;
import in.spreadarb.config.EngineConfig;
import in.spreadarb.config.PairSettings;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.common.ErrorSeverity;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.pair.TradingPair;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.domain.trade.DailyStats;
import in.spreadarb.domain.trade.ExecutionState;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.domain.trade.TradeResultStatus;
import in.spreadarb.infrastructure.exchange.ExchangeErrors;
import in.spreadarb.infrastructure.metrics.ArbitrageMetrics;
import in.spreadarb.service.balance.BalancePool;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.service.emergency.EmergencyGuard;
import in.spreadarb.service.execution.ExecutionCoordinator;
import in.spreadarb.service.execution.ExecutionHandle;
import in.spreadarb.service.execution.StrandedPositionMonitor;
import in.spreadarb.service.market.LatestTickerTable;
import in.spreadarb.service.market.MarketDataPoller;
import in.spreadarb.service.market.TickerPair;
import in.spreadarb.service.opportunity.OpportunityDetector;
import in.spreadarb.service.opportunity.StrategyEvaluator;
import in.spreadarb.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Engine lifecycle, wiring and the detect/execute loop.
 *
 * State machine:
 * <pre>
 * IDLE / STOPPED / ERROR -> STARTING -> RUNNING <-> PAUSED
 * RUNNING / PAUSED -> STOPPING -> STOPPED
 * any active state -> ERROR on an unhandled loop fault
 * </pre>
 *
 * Threads:
 * - market-poller-N: one loop per enabled pair, detection runs here
 * - arb-exec-N: two-leg executions
 * - engine-maintenance: balance refresh, day rollover, auto-resume
 * - engine-control: start and stop sequences
 *
 * Usage:
 * <pre>
 * EngineController engine = new EngineController(config, registry, strategy, history, bus, metrics, Clock.systemUTC());
 * engine.start().join();
 * ...
 * engine.stop().join();
 * </pre>
 */
public final class EngineController implements ArbitrageEngine, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private static final String SOURCE = "EngineController";

    private final ExchangeClientFactory clients;
    private final TradeHistoryRecorder history;
    private final EngineEventBus events;
    private final ArbitrageMetrics metrics;
    private final Clock clock;

    private final LatestTickerTable tickers;
    private final StrategyEvaluator strategies;
    private final MarketDataPoller poller;
    private final OpportunityDetector detector;
    private final StrandedPositionMonitor stranded;
    private final ExecutionCoordinator coordinator;
    private final BalancePool pool;
    private final TradeGate gate = new TradeGate();
    private final DailyStatsTracker stats;

    private final ScheduledExecutorService pollScheduler;
    private final ScheduledExecutorService maintenance;
    private final ExecutorService executionPool;
    private final ExecutorService control;

    private final ConcurrentHashMap<String, TradingPair> pairs = new ConcurrentHashMap<>();
    private final Object lifecycle = new Object();

    private volatile EngineConfig config;
    private volatile EngineStatus status = EngineStatus.IDLE;
    private volatile CancellationToken runToken;
    private volatile CompletableFuture<EngineStatus> stopping;
    private volatile EngineError lastError;
    private volatile EmergencyTriggerReason pausedBy;
    private volatile ScheduledFuture<?> autoResume;

    public EngineController(EngineConfig config,
                            ExchangeClientFactory clients,
                            TradingStrategy strategy,
                            TradeHistoryRecorder history,
                            EngineEventBus events,
                            ArbitrageMetrics metrics,
                            Clock clock) {
        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid engine configuration: " + errors);
        }
        this.config = config;
        this.clients = clients;
        this.history = history;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;

        this.pollScheduler = Executors.newScheduledThreadPool(
            Math.max(2, Math.min(8, config.pairs().size())), daemon("market-poller"));
        this.maintenance = Executors.newSingleThreadScheduledExecutor(daemon("engine-maintenance"));
        this.executionPool = Executors.newFixedThreadPool(config.engine().executionThreads(), daemon("arb-exec"));
        this.control = Executors.newSingleThreadExecutor(daemon("engine-control"));

        this.tickers = new LatestTickerTable();
        this.strategies = new StrategyEvaluator(strategy);
        this.poller = new MarketDataPoller(clients, tickers, events, metrics, pollScheduler, () -> this.config.polling());
        this.pool = new BalancePool(clients, tickers, events, new EmergencyGuard(() -> this.config.emergency()),
            this::poolExchanges, this::tradedAssets, () -> strategies.current().risk(),
            () -> this.config.balance(), clock);
        this.detector = new OpportunityDetector(clients, tickers, pool::currentSnapshot,
            () -> this.config.polling(), strategies, clock);
        this.stranded = new StrandedPositionMonitor(tickers, events, strategies);
        this.coordinator = new ExecutionCoordinator(clients, events, metrics, stranded, executionPool,
            strategies::current, () -> this.config.engine().tradingEnabled());
        this.stats = new DailyStatsTracker(clock);

        pool.onEmergency(this::onEmergency);
        events.addListener(new EngineEventListener() {
            @Override
            public void onError(EngineError error) {
                lastError = error;
            }
        });
        for (PairSettings settings : config.pairs()) {
            addTradingPair(settings.toTradingPair());
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<EngineStatus> start(CancellationToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        CancellationToken run;
        synchronized (lifecycle) {
            if (!status.canTransitionTo(EngineStatus.STARTING)) {
                log.info("[ENGINE] Start ignored, engine is {}", status);
                return CompletableFuture.completedFuture(status);
            }
            transition(EngineStatus.STARTING);
            run = CancellationToken.linkedTo(token);
            runToken = run;
            stopping = null;
        }
        token.onCancel(() -> {
            if (runToken == run) {
                stop();
            }
        });
        return CompletableFuture.supplyAsync(() -> startRun(run), control)
            .exceptionally(e -> {
                enterError("start failed: " + ExchangeErrors.describe(e), ExchangeErrors.unwrap(e));
                return status;
            });
    }

    private EngineStatus startRun(CancellationToken run) {
        log.info("[ENGINE] Starting: {} pair(s), trading {}", pairs.size(),
            config.engine().tradingEnabled() ? "ENABLED" : "disabled (detect only)");
        testConnections();
        primePrices();
        pool.initialize().join();

        synchronized (lifecycle) {
            if (status != EngineStatus.STARTING || runToken != run) {
                return status;
            }
            for (TradingPair pair : pairs.values()) {
                if (pair.enabled()) {
                    startPolling(pair, run);
                }
            }
            pool.startRefreshing(maintenance, run);
            ScheduledFuture<?> rollover = maintenance.scheduleAtFixedRate(stats::rollIfNeeded, 1, 1, TimeUnit.MINUTES);
            run.onCancel(() -> rollover.cancel(false));
            transition(EngineStatus.RUNNING);
        }
        log.info("[ENGINE] ✅ Running");
        if (run.isCancelled()) {
            stop();
            return status;
        }
        // A rule that fired while STARTING could not be applied then.
        try {
            pool.reevaluateEmergency().orTimeout(config.polling().tickerTimeoutMs(), TimeUnit.MILLISECONDS).join();
        } catch (RuntimeException e) {
            log.warn("[ENGINE] ⚠️ Post-start emergency check incomplete, next refresh repeats it: {}",
                ExchangeErrors.describe(e));
        }
        return status;
    }

    /**
     * One ticker round for every enabled pair so held base assets have a price when the
     * pool values its starting equity. Pairs that fail here are valued once polling reaches them.
     */
    private void primePrices() {
        boolean withBooks = strategies.current().entry().checkOrderBookDepth();
        for (TradingPair pair : pairs.values()) {
            if (!pair.enabled()) {
                continue;
            }
            try {
                poller.poll(pair, withBooks).join();
            } catch (RuntimeException e) {
                log.warn("[ENGINE] ⚠️ No opening prices for {}: {}", pair.symbol(), ExchangeErrors.describe(e));
            }
        }
    }

    private void testConnections() {
        long timeoutMs = config.polling().tickerTimeoutMs();
        for (String exchange : poolExchanges()) {
            Boolean ok;
            try {
                ok = clients.createClient(exchange).testConnection().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                throw new IllegalStateException("Connection test for " + exchange + " failed: "
                    + ExchangeErrors.describe(e), ExchangeErrors.unwrap(e));
            }
            if (!Boolean.TRUE.equals(ok)) {
                throw new IllegalStateException("Exchange " + exchange + " is not reachable");
            }
            log.info("[ENGINE] {} connected", exchange);
        }
    }

    @Override
    public CompletableFuture<EngineStatus> stop() {
        synchronized (lifecycle) {
            switch (status) {
                case RUNNING, PAUSED -> {
                    transition(EngineStatus.STOPPING);
                    haltRun();
                    long graceMs = config.engine().shutdownGraceMs();
                    stopping = CompletableFuture.supplyAsync(() -> drain(Duration.ofMillis(graceMs)), control);
                    return stopping;
                }
                case STOPPING -> {
                    CompletableFuture<EngineStatus> pending = stopping;
                    return pending != null ? pending : CompletableFuture.completedFuture(status);
                }
                case STARTING -> {
                    // startRun notices the cancelled token and stops once RUNNING.
                    if (runToken != null) {
                        runToken.cancel();
                    }
                    return CompletableFuture.completedFuture(status);
                }
                default -> {
                    haltRun();
                    return CompletableFuture.completedFuture(status);
                }
            }
        }
    }

    private EngineStatus drain(Duration grace) {
        List<ExecutionHandle> abandoned = coordinator.awaitInFlight(grace);
        for (ExecutionHandle handle : abandoned) {
            ExecutionState state = handle.state();
            publishError(new EngineError(SOURCE,
                String.format("Execution %s abandoned in state %s after %dms shutdown grace",
                    handle.tradeId(), state, grace.toMillis()),
                ErrorSeverity.CRITICAL, handle.symbol(), handle.tradeId(),
                state.holdsInventoryRisk() ? "Verify " + handle.symbol() + " balances on both exchanges" : null,
                null, null, Instant.now()));
        }
        synchronized (lifecycle) {
            if (status == EngineStatus.STOPPING) {
                transition(EngineStatus.STOPPED);
            }
        }
        log.info("[ENGINE] Stopped{}", abandoned.isEmpty() ? "" : " with " + abandoned.size() + " abandoned execution(s)");
        return status;
    }

    @Override
    public EngineStatus pause() {
        synchronized (lifecycle) {
            if (status == EngineStatus.RUNNING) {
                transition(EngineStatus.PAUSED);
            }
            return status;
        }
    }

    @Override
    public EngineStatus resume() {
        synchronized (lifecycle) {
            if (status != EngineStatus.PAUSED) {
                return status;
            }
            transition(EngineStatus.RUNNING);
            cancelAutoResume();
            pausedBy = null;
        }
        pool.acknowledgeLossStreak();
        detector.resetConfirmations();
        return status;
    }

    @Override
    public EngineStatus status() {
        return status;
    }

    @Override
    public Optional<EngineError> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Stop, then release every thread the engine owns. The event bus belongs to the caller.
     */
    @Override
    public void close() {
        try {
            stop().get(config.engine().shutdownGraceMs() + 5_000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("[ENGINE] Stop during close did not finish cleanly: {}", e.getMessage());
        }
        pollScheduler.shutdownNow();
        maintenance.shutdownNow();
        executionPool.shutdown();
        control.shutdown();
        pool.close();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // DETECT / EXECUTE LOOP
    // ═══════════════════════════════════════════════════════════════════════

    private final MarketDataPoller.PairCycleHandler cycleHandler = new MarketDataPoller.PairCycleHandler() {
        @Override
        public void onTickers(TradingPair pair, TickerPair quotes) {
            onCycle(pair, quotes);
        }

        @Override
        public void onLoopFault(TradingPair pair, Throwable error) {
            enterError("detection loop for " + pair.symbol() + " failed: " + error.getMessage(), error);
        }
    };

    private void onCycle(TradingPair polled, TickerPair quotes) {
        TradingPair pair = pairs.get(polled.symbol());
        if (pair == null || !pair.enabled()) {
            return;
        }
        Instant now = clock.instant();
        stranded.evaluate(pair.symbol(), now);

        SpreadOpportunity opportunity = detector.evaluate(pair, quotes);
        if (!opportunity.shouldTrade()) {
            metrics.recordOpportunity(pair.symbol(), false);
            return;
        }
        events.publish(EventType.OPPORTUNITY_FOUND, l -> l.onOpportunityFound(opportunity));

        if (status != EngineStatus.RUNNING) {
            metrics.recordExecutionSkipped(pair.symbol(), "paused");
            return;
        }
        if (!config.engine().tradingEnabled()) {
            metrics.recordExecutionSkipped(pair.symbol(), "trading_disabled");
            return;
        }
        if (coordinator.isBusy(pair.symbol())) {
            metrics.recordExecutionSkipped(pair.symbol(), "pair_busy");
            return;
        }
        Optional<String> refused = gate.admit(now, coordinator.inFlight().size() + stranded.count(),
            strategies.current().risk());
        if (refused.isPresent()) {
            log.debug("[ENGINE] {} opportunity refused: {}", pair.symbol(), refused.get());
            metrics.recordExecutionSkipped(pair.symbol(), refused.get());
            return;
        }
        CancellationToken run = runToken;
        coordinator.tryExecute(opportunity, pair, run != null ? run : CancellationToken.none())
            .ifPresent(result -> result.whenComplete(this::onTradeFinished));
    }

    private void onTradeFinished(TradeResult result, Throwable error) {
        if (error != null) {
            enterError("execution failed: " + error.getMessage(), error);
            return;
        }
        try {
            if (result.status() != TradeResultStatus.CANCELLED) {
                history.record(result);
            }
            stats.record(result);
            pool.recordTrade(result);
            events.publish(EventType.TRADE_COMPLETED, l -> l.onTradeCompleted(result));
        } catch (RuntimeException e) {
            enterError("recording trade " + result.tradeId() + " failed", e);
        }
    }

    /**
     * Returns false for a pause that arrives while STARTING, so the pool raises it again
     * once the engine is running.
     */
    private boolean onEmergency(EmergencyCheck check) {
        switch (check.action()) {
            case STOP_TRADING -> {
                log.error("[ENGINE] 🚨 Emergency stop: {}", check.message());
                stop();
                return true;
            }
            case PAUSE_TRADING -> {
                synchronized (lifecycle) {
                    if (status == EngineStatus.STARTING) {
                        log.warn("[ENGINE] ⚠️ Emergency pause pending until running: {}", check.message());
                        return false;
                    }
                    log.warn("[ENGINE] ⚠️ Emergency pause: {}", check.message());
                    if (pause() == EngineStatus.PAUSED) {
                        pausedBy = check.reason();
                        if (check.reason() == EmergencyTriggerReason.CONSECUTIVE_LOSSES) {
                            scheduleAutoResume();
                        }
                    }
                    return true;
                }
            }
            default -> {
                return true;
            }
        }
    }

    private void scheduleAutoResume() {
        int minutes = strategies.current().risk().pauseAfterLossesMinutes();
        if (minutes <= 0) {
            log.info("[ENGINE] Paused until resumed by hand");
            return;
        }
        cancelAutoResume();
        autoResume = maintenance.schedule(() -> {
            if (status == EngineStatus.PAUSED && pausedBy == EmergencyTriggerReason.CONSECUTIVE_LOSSES) {
                log.info("[ENGINE] Resuming after {} min loss-streak pause", minutes);
                resume();
            }
        }, minutes, TimeUnit.MINUTES);
        log.info("[ENGINE] Auto-resume in {} min", minutes);
    }

    private void cancelAutoResume() {
        ScheduledFuture<?> pending = autoResume;
        if (pending != null) {
            pending.cancel(false);
            autoResume = null;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PAIRS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void addTradingPair(TradingPair pair) {
        if (pair == null) {
            throw new IllegalArgumentException("pair cannot be null");
        }
        clients.createClient(pair.legA().exchange());
        clients.createClient(pair.legB().exchange());
        synchronized (lifecycle) {
            TradingPair previous = pairs.put(pair.symbol(), pair);
            if (previous != null) {
                poller.stop(pair.symbol());
            }
            if (pair.enabled() && (status == EngineStatus.RUNNING || status == EngineStatus.PAUSED)) {
                startPolling(pair, runToken);
            }
        }
        log.info("[ENGINE] Pair {} registered ({} / {}, {})", pair.symbol(), pair.legA().exchange(),
            pair.legB().exchange(), pair.enabled() ? "enabled" : "disabled");
    }

    @Override
    public boolean removeTradingPair(String symbol) {
        TradingPair removed;
        synchronized (lifecycle) {
            removed = pairs.remove(symbol);
            poller.stop(symbol);
        }
        if (removed != null) {
            tickers.remove(symbol);
            log.info("[ENGINE] Pair {} removed", symbol);
        }
        return removed != null;
    }

    @Override
    public boolean setPairEnabled(String symbol, boolean enabled) {
        TradingPair current = pairs.get(symbol);
        if (current == null) {
            return false;
        }
        if (current.enabled() != enabled) {
            addTradingPair(current.withEnabled(enabled));
        }
        return true;
    }

    @Override
    public List<TradingPair> getTradingPairs() {
        List<TradingPair> result = new ArrayList<>(pairs.values());
        result.sort(Comparator.comparing(TradingPair::symbol));
        return result;
    }

    private void startPolling(TradingPair pair, CancellationToken run) {
        poller.start(pair, run, () -> strategies.current().entry().checkOrderBookDepth(), cycleHandler);
    }

    private Set<String> poolExchanges() {
        Set<String> exchanges = new TreeSet<>();
        for (TradingPair pair : pairs.values()) {
            exchanges.add(pair.legA().exchange());
            exchanges.add(pair.legB().exchange());
        }
        return exchanges;
    }

    private Set<String> tradedAssets() {
        Set<String> assets = new HashSet<>();
        for (TradingPair pair : pairs.values()) {
            if (pair.enabled()) {
                assets.add(pair.baseCurrency());
                assets.add(pair.quoteCurrency());
            }
        }
        return assets;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ON-DEMAND
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<SpreadOpportunity> analyzeOpportunity(TradingPair pair) {
        if (pair == null) {
            throw new IllegalArgumentException("pair cannot be null");
        }
        CompletableFuture<TickerPair> quotes;
        try {
            quotes = poller.poll(pair, strategies.current().entry().checkOrderBookDepth());
        } catch (RuntimeException e) {
            quotes = CompletableFuture.failedFuture(e);
        }
        return quotes.thenApply(q -> detector.evaluate(pair, q))
            .exceptionally(e -> SpreadOpportunity.none(pair.symbol(),
                "Market data unavailable: " + ExchangeErrors.describe(e)));
    }

    @Override
    public CompletableFuture<TradeResult> executeArbitrage(SpreadOpportunity opportunity) {
        if (opportunity == null) {
            throw new IllegalArgumentException("opportunity cannot be null");
        }
        TradingPair pair = pairs.get(opportunity.symbol());
        if (pair == null) {
            return CompletableFuture.completedFuture(TradeResult.builder()
                .opportunity(opportunity)
                .status(TradeResultStatus.ERROR)
                .executionState(ExecutionState.FAILED)
                .errorMessage("Unknown trading pair " + opportunity.symbol())
                .build());
        }
        CancellationToken run = runToken;
        CancellationToken token = status.isActive() && run != null ? run : CancellationToken.none();
        return coordinator.execute(opportunity, pair, token).thenApply(result -> {
            onTradeFinished(result, null);
            return result;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONFIGURATION AND STATS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Engine, polling, balance and emergency settings take effect from the next cycle.
     * Pairs in the new configuration that are not registered yet are added.
     */
    @Override
    public void updateConfig(EngineConfig next) {
        if (next == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        List<String> errors = next.validate();
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid engine configuration: " + errors);
        }
        this.config = next;
        for (PairSettings settings : next.pairs()) {
            if (!pairs.containsKey(settings.symbol())) {
                addTradingPair(settings.toTradingPair());
            }
        }
        log.info("[ENGINE] Configuration updated (trading {}, poll {}ms)",
            next.engine().tradingEnabled() ? "enabled" : "disabled", next.polling().intervalMs());
    }

    @Override
    public void reloadStrategy(TradingStrategy strategy) {
        strategies.reload(strategy);
        detector.resetConfirmations();
    }

    @Override
    public void resetDailyStats() {
        stats.reset();
        pool.resetDailyLoss();
    }

    @Override
    public DailyStats getTodayStats() {
        return stats.today();
    }

    @Override
    public List<TradeResult> getTradeHistory(int count) {
        return history.recent(count);
    }

    @Override
    public BalancePoolService balancePool() {
        return pool;
    }

    @Override
    public void addListener(EngineEventListener listener) {
        events.addListener(listener);
    }

    @Override
    public void removeListener(EngineEventListener listener) {
        events.removeListener(listener);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    // Caller holds the lifecycle lock.
    private void transition(EngineStatus next) {
        EngineStatus previous = status;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + previous + " -> " + next);
        }
        status = next;
        log.info("[ENGINE] {} -> {}", previous, next);
        events.publish(EventType.STATUS_CHANGED, l -> l.onStatusChanged(previous, next));
    }

    private void haltRun() {
        CancellationToken run = runToken;
        if (run != null) {
            run.cancel();
        }
        poller.stopAll();
        cancelAutoResume();
    }

    private void enterError(String message, Throwable cause) {
        synchronized (lifecycle) {
            if (status.canTransitionTo(EngineStatus.ERROR)) {
                transition(EngineStatus.ERROR);
            }
            haltRun();
        }
        log.error("[ENGINE] {}", message, cause);
        publishError(EngineError.of(SOURCE, ErrorSeverity.CRITICAL, null, message, cause));
    }

    private void publishError(EngineError error) {
        lastError = error;
        events.publish(EventType.ERROR_OCCURRED, l -> l.onError(error));
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
