package in.spreadarb.service.balance;

import in.spreadarb.application.port.input.BalancePoolService;
import in.spreadarb.application.port.output.ExchangeClientFactory;
import in.spreadarb.application.port.output.PriceOracle;
import in.spreadarb.config.BalanceSettings;
import in.spreadarb.domain.balance.AccountBalance;
import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.balance.PoolPnl;
import in.spreadarb.domain.balance.RebalanceRecommendation;
import in.spreadarb.domain.balance.RebalanceUrgency;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.strategy.RiskRules;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.infrastructure.exchange.ExchangeErrors;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.service.emergency.EmergencyGuard;
import in.spreadarb.service.emergency.GuardInput;
import in.spreadarb.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Single-writer balance pool.
 *
 * All state changes run on one "balance-pool" thread, in submission order. Readers get the
 * latest immutable snapshot through a volatile field and never block.
 *
 * Realized P&L is applied as soon as a trade is recorded. Exchange balances fetched later
 * already contain trades finished before the fetch started, so only trades recorded
 * while a fetch was running are carried on top of it.
 *
 * After every change the emergency rules are evaluated. A firing rule is published once
 * and passed to the emergency handler; it fires again only after it has cleared.
 */
public final class BalancePool implements BalancePoolService, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BalancePool.class);

    private final ExchangeClientFactory clients;
    private final PriceOracle prices;
    private final EngineEventBus events;
    private final EmergencyGuard guard;
    private final Supplier<Set<String>> exchanges;
    private final Supplier<Set<String>> tradedAssets;
    private final Supplier<RiskRules> risk;
    private final Supplier<BalanceSettings> settings;
    private final Clock clock;
    private final ExecutorService actor;

    private volatile Predicate<EmergencyCheck> emergencyHandler = check -> true;
    private volatile CombinedBalanceSnapshot snapshot = CombinedBalanceSnapshot.empty();
    private volatile PoolPnl pnl = new PoolPnl(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
        BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    private volatile GuardInput lastGuardInput;
    private final Deque<CombinedBalanceSnapshot> history = new ArrayDeque<>();

    // ═══════════════════════════════════════════════════════════════════════
    // ACTOR STATE (balance-pool thread only)
    // ═══════════════════════════════════════════════════════════════════════
    private Map<String, AccountBalance> accounts = Map.of();
    private BigDecimal fetchedEquity = BigDecimal.ZERO;
    private BigDecimal startingEquity = BigDecimal.ZERO;
    private BigDecimal peakEquity = BigDecimal.ZERO;
    private BigDecimal maxDrawdown = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal dailyPnl = BigDecimal.ZERO;
    private LocalDate dailyDate;
    private long tradeSequence;
    private final Deque<Adjustment> adjustments = new ArrayDeque<>();
    private final Deque<TradeResult> recentTrades = new ArrayDeque<>();
    private Instant acknowledgedAt = Instant.EPOCH;
    private EmergencyTriggerReason lastFired;
    private RebalanceUrgency lastRebalanceUrgency = RebalanceUrgency.NONE;

    private record Adjustment(long sequence, BigDecimal pnl) {}

    public BalancePool(ExchangeClientFactory clients,
                       PriceOracle prices,
                       EngineEventBus events,
                       EmergencyGuard guard,
                       Supplier<Set<String>> exchanges,
                       Supplier<Set<String>> tradedAssets,
                       Supplier<RiskRules> risk,
                       Supplier<BalanceSettings> settings,
                       Clock clock) {
        this.clients = clients;
        this.prices = prices;
        this.events = events;
        this.guard = guard;
        this.exchanges = exchanges;
        this.tradedAssets = tradedAssets;
        this.risk = risk;
        this.settings = settings;
        this.clock = clock;
        this.actor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "balance-pool");
            t.setDaemon(true);
            return t;
        });
        this.dailyDate = LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    /**
     * The handler returns false when it could not act on the check yet; the same reason then
     * fires again on the next evaluation instead of being suppressed as already handled.
     */
    public void onEmergency(Predicate<EmergencyCheck> handler) {
        this.emergencyHandler = handler != null ? handler : check -> true;
    }

    /**
     * Run the emergency rules against the latest snapshot on the pool thread and hand a
     * firing rule to the handler, as a refresh would.
     */
    public CompletableFuture<Optional<EmergencyCheck>> reevaluateEmergency() {
        return CompletableFuture.supplyAsync(() -> {
            if (lastGuardInput == null) {
                return Optional.<EmergencyCheck>empty();
            }
            return evaluateGuard(snapshot);
        }, actor);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MUTATIONS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<CombinedBalanceSnapshot> initialize() {
        log.info("[BALANCE] Initializing from {}", exchanges.get());
        return fetchAll(true).thenApplyAsync(fetched -> {
            if (fetched.size() < exchanges.get().size()) {
                throw new IllegalStateException("Balances unavailable from " + missing(fetched));
            }
            accounts = fetched;
            fetchedEquity = BalanceValuation.value(accounts, prices, settings.get().valuationCurrency()).totalEquity();
            adjustments.clear();
            startingEquity = fetchedEquity;
            peakEquity = fetchedEquity;
            maxDrawdown = BigDecimal.ZERO;
            realizedPnl = BigDecimal.ZERO;
            recentTrades.clear();
            acknowledgedAt = clock.instant();
            lastFired = null;
            lastRebalanceUrgency = RebalanceUrgency.NONE;
            if (startingEquity.signum() <= 0) {
                log.warn("[BALANCE] ⚠️ Starting equity is {}; check prices for held assets", startingEquity);
            }
            log.info("[BALANCE] ✅ Initialized with equity {} {}", startingEquity, settings.get().valuationCurrency());
            return publish(true);
        }, actor);
    }

    @Override
    public CompletableFuture<CombinedBalanceSnapshot> refresh() {
        CompletableFuture<Long> sequenceAtStart = CompletableFuture.supplyAsync(() -> tradeSequence, actor);
        return sequenceAtStart.thenCompose(sequence -> fetchAll(false).thenApplyAsync(fetched -> {
            Map<String, AccountBalance> merged = new LinkedHashMap<>(accounts);
            merged.putAll(fetched);
            accounts = Map.copyOf(merged);
            fetchedEquity = BalanceValuation.value(accounts, prices, settings.get().valuationCurrency()).totalEquity();
            adjustments.removeIf(a -> a.sequence() <= sequence);
            return publish(true);
        }, actor));
    }

    @Override
    public CompletableFuture<CombinedBalanceSnapshot> recordTrade(TradeResult result) {
        return CompletableFuture.supplyAsync(() -> {
            rollDay();
            if (!result.isExecuted()) {
                return snapshot;
            }
            tradeSequence++;
            adjustments.addLast(new Adjustment(tradeSequence, result.netPnl()));
            realizedPnl = realizedPnl.add(result.netPnl());
            dailyPnl = dailyPnl.add(result.netPnl());
            recentTrades.addLast(result);
            while (recentTrades.size() > settings.get().historySize()) {
                recentTrades.removeFirst();
            }
            log.debug("[BALANCE] Recorded {} pnl={} realized={}", result.tradeId(), result.netPnl(), realizedPnl);
            return publish(false);
        }, actor);
    }

    @Override
    public void acknowledgeLossStreak() {
        actor.execute(() -> {
            acknowledgedAt = clock.instant();
            lastFired = null;
            log.info("[BALANCE] Loss streak acknowledged at {}", acknowledgedAt);
            publish(false);
        });
    }

    @Override
    public void resetDailyLoss() {
        actor.execute(() -> {
            dailyPnl = BigDecimal.ZERO;
            dailyDate = LocalDate.now(clock.withZone(ZoneOffset.UTC));
            log.info("[BALANCE] Daily P&L reset");
            publish(false);
        });
    }

    /**
     * Refresh every {@code refreshIntervalMs} until {@code token} is cancelled.
     */
    public void startRefreshing(ScheduledExecutorService scheduler, CancellationToken token) {
        long interval = settings.get().refreshIntervalMs();
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(() -> refresh().exceptionally(e -> {
            log.warn("[BALANCE] Refresh failed: {}", ExchangeErrors.describe(e));
            return null;
        }), interval, interval, TimeUnit.MILLISECONDS);
        token.onCancel(() -> task.cancel(false));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // READS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CombinedBalanceSnapshot currentSnapshot() {
        return snapshot;
    }

    @Override
    public BigDecimal currentDrawdown() {
        return snapshot.drawdownPercent();
    }

    @Override
    public BigDecimal realizedPnl() {
        return pnl.realizedPnl();
    }

    @Override
    public BigDecimal maxDrawdown() {
        return pnl.maxDrawdownPercent();
    }

    @Override
    public List<CombinedBalanceSnapshot> history(int count) {
        List<CombinedBalanceSnapshot> result = new ArrayList<>();
        synchronized (history) {
            Iterator<CombinedBalanceSnapshot> it = history.descendingIterator();
            while (it.hasNext() && result.size() < count) {
                result.add(it.next());
            }
        }
        return result;
    }

    @Override
    public PoolPnl pnl() {
        return pnl;
    }

    @Override
    public RebalanceRecommendation calculateRebalance() {
        return RebalanceCalculator.calculate(snapshot, settings.get().rebalanceThresholdPercent(), tradedAssets.get());
    }

    @Override
    public Optional<EmergencyCheck> checkEmergency() {
        GuardInput input = lastGuardInput;
        if (input == null) {
            return Optional.empty();
        }
        return guard.check(input, risk.get());
    }

    @Override
    public void close() {
        actor.shutdownNow();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS (actor thread)
    // ═══════════════════════════════════════════════════════════════════════

    private CombinedBalanceSnapshot publish(boolean fromExchanges) {
        rollDay();
        BigDecimal carried = adjustments.stream().map(Adjustment::pnl).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal equity = fetchedEquity.add(carried);
        peakEquity = EquityMath.newPeak(peakEquity, equity);
        BigDecimal drawdown = EquityMath.drawdownPercent(peakEquity, equity);
        maxDrawdown = maxDrawdown.max(drawdown);

        BalanceValuation.Valuation valuation =
            BalanceValuation.value(accounts, prices, settings.get().valuationCurrency());
        CombinedBalanceSnapshot next = new CombinedBalanceSnapshot(clock.instant(), accounts, valuation.assets(),
            equity, peakEquity, drawdown, realizedPnl);
        snapshot = next;
        synchronized (history) {
            history.addLast(next);
            while (history.size() > settings.get().historySize()) {
                history.removeFirst();
            }
        }
        pnl = new PoolPnl(startingEquity, equity, realizedPnl, EquityMath.returnPercent(startingEquity, realizedPnl),
            peakEquity, drawdown, maxDrawdown);
        events.publish(EventType.BALANCE_UPDATED, l -> l.onBalanceUpdated(next));

        if (fromExchanges) {
            publishRebalance();
        }
        evaluateGuard(next);
        return next;
    }

    private void publishRebalance() {
        RebalanceRecommendation recommendation = calculateRebalance();
        if (recommendation.urgency().atLeast(RebalanceUrgency.MEDIUM)
            && recommendation.urgency() != lastRebalanceUrgency) {
            log.warn("[BALANCE] Rebalance recommended: {}", recommendation.summary());
            events.publish(EventType.REBALANCE_RECOMMENDED, l -> l.onRebalanceRecommended(recommendation));
        }
        lastRebalanceUrgency = recommendation.urgency();
    }

    private Optional<EmergencyCheck> evaluateGuard(CombinedBalanceSnapshot current) {
        List<TradeResult> sinceAck = new ArrayList<>();
        for (TradeResult trade : recentTrades) {
            if (!trade.endedAt().isBefore(acknowledgedAt)) {
                sinceAck.add(trade);
            }
        }
        GuardInput input = new GuardInput(clock.instant(), current.drawdownPercent(),
            dailyPnl.signum() < 0 ? dailyPnl.negate() : BigDecimal.ZERO, startingEquity, sinceAck, current,
            tradedAssets.get(), settings.get().rebalanceThresholdPercent());
        lastGuardInput = input;

        Optional<EmergencyCheck> check = guard.check(input, risk.get());
        if (check.isEmpty()) {
            lastFired = null;
            return check;
        }
        EmergencyCheck fired = check.get();
        if (fired.reason() == lastFired) {
            return check;
        }
        lastFired = fired.reason();
        log.error("[BALANCE] 🚨 Emergency {}: {} -> {}", fired.reason(), fired.message(), fired.action());
        events.publish(EventType.EMERGENCY_TRIGGERED, l -> l.onEmergencyTriggered(fired));
        try {
            if (!emergencyHandler.test(fired)) {
                lastFired = null;
            }
        } catch (RuntimeException e) {
            log.error("[BALANCE] Emergency handler failed for {}", fired.reason(), e);
        }
        return check;
    }

    private void rollDay() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(dailyDate)) {
            log.info("[BALANCE] New trading day {}, daily P&L {} reset", today, dailyPnl);
            dailyDate = today;
            dailyPnl = BigDecimal.ZERO;
        }
    }

    /**
     * Balances from every pool exchange that answered. With {@code strict} the first
     * failure fails the whole fetch.
     */
    private CompletableFuture<Map<String, AccountBalance>> fetchAll(boolean strict) {
        Map<String, CompletableFuture<AccountBalance>> calls = new HashMap<>();
        for (String exchange : exchanges.get()) {
            CompletableFuture<AccountBalance> call;
            try {
                call = clients.createClient(exchange).getBalance();
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            calls.put(exchange, call);
        }
        return CompletableFuture.allOf(calls.values().toArray(CompletableFuture[]::new))
            .handle((ignored, error) -> {
                Map<String, AccountBalance> fetched = new LinkedHashMap<>();
                for (Map.Entry<String, CompletableFuture<AccountBalance>> call : calls.entrySet()) {
                    if (call.getValue().isCompletedExceptionally()) {
                        Throwable cause = call.getValue().handle((v, e) -> e).join();
                        String reason = ExchangeErrors.describe(cause);
                        if (strict) {
                            throw new IllegalStateException("Balance fetch from " + call.getKey() + " failed: " + reason, cause);
                        }
                        log.warn("[BALANCE] Balance fetch from {} failed, keeping previous: {}", call.getKey(), reason);
                        continue;
                    }
                    fetched.put(call.getKey(), call.getValue().join());
                }
                return fetched;
            });
    }

    private String missing(Map<String, AccountBalance> fetched) {
        List<String> missing = new ArrayList<>(exchanges.get());
        missing.removeAll(fetched.keySet());
        return missing.toString();
    }
}
