package in.spreadarb.service.execution;

import in.spreadarb.application.port.output.ExchangeClient;
import in.spreadarb.application.port.output.ExchangeClientFactory;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.common.ErrorSeverity;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.order.Order;
import in.spreadarb.domain.order.OrderSide;
import in.spreadarb.domain.pair.TradingPair;
import in.spreadarb.domain.strategy.AdvancedRules;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.domain.trade.ExecutionState;
import in.spreadarb.domain.trade.HeldInventory;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.domain.trade.TradeResultStatus;
import in.spreadarb.infrastructure.metrics.ArbitrageMetrics;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Runs two-leg arbitrage attempts: buy on the cheap exchange, then sell exactly the
 * filled quantity on the expensive one.
 *
 * Features:
 * - At most one attempt per pair; a busy pair drops new opportunities
 * - Attempts run on a bounded execution pool, off the polling threads
 * - A buy leg with no fill ends the attempt with no sell
 * - A sell leg that does not complete leaves held inventory, reported as a CRITICAL error
 *   and handed to the stranded position monitor
 * - Every path produces a TradeResult; nothing is thrown to the caller
 *
 * Usage:
 * <pre>
 * coordinator.tryExecute(opportunity, pair, runToken)
 *     .ifPresent(f -> f.thenAccept(this::onTradeFinished));
 * </pre>
 */
public final class ExecutionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private static final String SOURCE = "ExecutionCoordinator";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ExchangeClientFactory clients;
    private final EngineEventBus events;
    private final ArbitrageMetrics metrics;
    private final StrandedPositionMonitor stranded;
    private final ExecutorService executionPool;
    private final Supplier<TradingStrategy> strategy;
    private final BooleanSupplier tradingEnabled;
    private final LegExecutor legs;

    // symbol -> in-flight attempt. Presence of a key is the per-pair lock.
    private final ConcurrentHashMap<String, ExecutionHandle> inFlight = new ConcurrentHashMap<>();

    public ExecutionCoordinator(ExchangeClientFactory clients,
                                EngineEventBus events,
                                ArbitrageMetrics metrics,
                                StrandedPositionMonitor stranded,
                                ExecutorService executionPool,
                                Supplier<TradingStrategy> strategy,
                                BooleanSupplier tradingEnabled) {
        this(clients, events, metrics, stranded, executionPool, strategy, tradingEnabled, new LegExecutor());
    }

    ExecutionCoordinator(ExchangeClientFactory clients,
                         EngineEventBus events,
                         ArbitrageMetrics metrics,
                         StrandedPositionMonitor stranded,
                         ExecutorService executionPool,
                         Supplier<TradingStrategy> strategy,
                         BooleanSupplier tradingEnabled,
                         LegExecutor legs) {
        this.clients = clients;
        this.events = events;
        this.metrics = metrics;
        this.stranded = stranded;
        this.executionPool = executionPool;
        this.strategy = strategy;
        this.tradingEnabled = tradingEnabled;
        this.legs = legs;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ENTRY POINTS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Start an attempt unless one is already running for the pair.
     *
     * @return the attempt's result, or empty when the pair was busy
     */
    public Optional<CompletableFuture<TradeResult>> tryExecute(SpreadOpportunity opportunity, TradingPair pair,
                                                               CancellationToken token) {
        ExecutionHandle handle = new ExecutionHandle(UUID.randomUUID().toString(), pair.symbol(), Instant.now());
        ExecutionHandle existing = inFlight.putIfAbsent(pair.symbol(), handle);
        if (existing != null) {
            log.debug("[EXEC] {} busy with {}, dropping opportunity", pair.symbol(), existing.tradeId());
            metrics.recordExecutionSkipped(pair.symbol(), "pair_busy");
            return Optional.empty();
        }
        metrics.setInFlightExecutions(inFlight.size());
        try {
            executionPool.execute(() -> run(handle, opportunity, pair, token));
        } catch (RejectedExecutionException e) {
            finish(handle, cancelled(handle, opportunity, "Execution pool unavailable"));
        }
        return Optional.of(handle.result());
    }

    /**
     * Like {@link #tryExecute} but always returns a result; a busy pair yields CANCELLED.
     */
    public CompletableFuture<TradeResult> execute(SpreadOpportunity opportunity, TradingPair pair,
                                                  CancellationToken token) {
        return tryExecute(opportunity, pair, token).orElseGet(() -> {
            ExecutionHandle rejected = new ExecutionHandle(UUID.randomUUID().toString(), pair.symbol(), Instant.now());
            return CompletableFuture.completedFuture(
                cancelled(rejected, opportunity, "Another execution is in progress for " + pair.symbol()));
        });
    }

    public boolean isBusy(String symbol) {
        return inFlight.containsKey(symbol);
    }

    public List<ExecutionHandle> inFlight() {
        return new ArrayList<>(inFlight.values());
    }

    /**
     * Wait for every in-flight attempt, up to {@code grace}.
     *
     * @return the attempts still running when the grace period ran out
     */
    public List<ExecutionHandle> awaitInFlight(Duration grace) {
        List<ExecutionHandle> pending = inFlight();
        if (pending.isEmpty()) {
            return List.of();
        }
        log.info("[EXEC] Waiting up to {}ms for {} execution(s): {}", grace.toMillis(), pending.size(), pending);
        CompletableFuture<?>[] futures = pending.stream().map(ExecutionHandle::result).toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[EXEC] ⚠️ Grace period expired");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.debug("[EXEC] In-flight execution completed exceptionally", e);
        }
        List<ExecutionHandle> abandoned = new ArrayList<>();
        for (ExecutionHandle handle : pending) {
            if (!handle.result().isDone()) {
                abandoned.add(handle);
            }
        }
        return abandoned;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ATTEMPT
    // ═══════════════════════════════════════════════════════════════════════

    private void run(ExecutionHandle handle, SpreadOpportunity opportunity, TradingPair pair, CancellationToken token) {
        TradeResult result;
        try {
            result = attempt(handle, opportunity, pair, token);
        } catch (RuntimeException e) {
            log.error("[EXEC] {} unexpected failure in state {}", handle.tradeId(), handle.state(), e);
            boolean exposed = handle.state().holdsInventoryRisk();
            publishError(new EngineError(SOURCE, "Execution failed unexpectedly in state " + handle.state()
                + ": " + e.getMessage(), exposed ? ErrorSeverity.CRITICAL : ErrorSeverity.HIGH,
                pair.symbol(), handle.tradeId(), exposed ? "Check " + pair.baseCurrency() + " balances on "
                + opportunity.buyExchange() + " and " + opportunity.sellExchange() : null, null, e, Instant.now()));
            result = TradeResult.builder()
                .tradeId(handle.tradeId())
                .opportunity(opportunity)
                .status(TradeResultStatus.ERROR)
                .executionState(exposed ? ExecutionState.PARTIAL_FAILURE : ExecutionState.FAILED)
                .startedAt(handle.startedAt())
                .errorMessage(e.getMessage())
                .build();
        }
        finish(handle, result);
    }

    private TradeResult attempt(ExecutionHandle handle, SpreadOpportunity opportunity, TradingPair pair,
                                CancellationToken token) {
        if (!tradingEnabled.getAsBoolean()) {
            return cancelled(handle, opportunity, "Trading disabled");
        }
        if (token.isCancelled()) {
            return cancelled(handle, opportunity, "Engine stopping");
        }
        if (!opportunity.hasDirection() || opportunity.suggestedQuantity().signum() <= 0) {
            return cancelled(handle, opportunity, "Opportunity is not executable");
        }

        AdvancedRules rules = strategy.get().advanced();
        ExchangeClient buyClient = clients.createClient(opportunity.buyExchange());
        ExchangeClient sellClient = clients.createClient(opportunity.sellExchange());
        String buySymbol = pair.leg(opportunity.buyExchange()).exchangeSymbol();
        String sellSymbol = pair.leg(opportunity.sellExchange()).exchangeSymbol();

        TradeResult.Builder result = TradeResult.builder()
            .tradeId(handle.tradeId())
            .opportunity(opportunity)
            .startedAt(handle.startedAt());

        log.info("[EXEC] {} {} buy {} {} on {} / sell on {} (net {}%)", handle.tradeId(), pair.symbol(),
            opportunity.suggestedQuantity(), pair.baseCurrency(), opportunity.buyExchange(),
            opportunity.sellExchange(), opportunity.netSpreadPercent().setScale(4, RoundingMode.HALF_UP));

        // ═══════════════════════════════════════════════════════════════════════
        // BUY LEG
        // ═══════════════════════════════════════════════════════════════════════
        handle.advance(ExecutionState.BUY_LEG_SUBMITTED);
        LegOutcome buy = legs.execute(buyClient, new LegExecutor.LegRequest(handle.tradeId(), buySymbol,
            OrderSide.BUY, opportunity.suggestedQuantity(), opportunity.buyPrice()), rules);
        result.buyOrder(buy.order())
            .metadata("buyLegMs", buy.elapsed().toMillis())
            .metadata("buyChildOrders", buy.childOrders())
            .metadata("buyRetries", buy.retries());

        if (!buy.hasFill()) {
            handle.advance(ExecutionState.FAILED);
            String reason = buy.error() != null ? buy.error() : "Buy leg not filled";
            if (buy.hasUnsettledOrders()) {
                publishError(new EngineError(SOURCE, "Buy leg failed with unconfirmed order(s) "
                    + buy.unsettledOrderIds() + " on " + opportunity.buyExchange() + ": " + reason,
                    ErrorSeverity.HIGH, pair.symbol(), handle.tradeId(),
                    verifyOrders(opportunity.buyExchange(), buy), null, null, Instant.now()));
            } else {
                publishError(new EngineError(SOURCE, "Buy leg failed: " + reason, ErrorSeverity.MEDIUM,
                    pair.symbol(), handle.tradeId(), null, null, null, Instant.now()));
            }
            return result.status(TradeResultStatus.BUY_LEG_FAILED)
                .executionState(ExecutionState.FAILED)
                .totalFees(buy.order() == null ? BigDecimal.ZERO : buy.order().fee())
                .errorMessage(reason)
                .build();
        }

        Order buyOrder = buy.order();
        handle.advance(ExecutionState.BUY_LEG_FILLED);
        reportUnsettled(pair, handle, opportunity.buyExchange(), buy);
        checkSlippage(result, handle, pair, "buy", opportunity.buyPrice(), buyOrder.averageFillPrice(), rules);

        // ═══════════════════════════════════════════════════════════════════════
        // SELL LEG (exactly the bought quantity)
        // ═══════════════════════════════════════════════════════════════════════
        BigDecimal sellQuantity = buyOrder.filledQuantity();
        handle.advance(ExecutionState.SELL_LEG_SUBMITTED);
        LegOutcome sell = legs.execute(sellClient, new LegExecutor.LegRequest(handle.tradeId(), sellSymbol,
            OrderSide.SELL, sellQuantity, opportunity.sellPrice()), rules);
        result.sellOrder(sell.order())
            .metadata("sellLegMs", sell.elapsed().toMillis())
            .metadata("sellChildOrders", sell.childOrders())
            .metadata("sellRetries", sell.retries());

        reportUnsettled(pair, handle, opportunity.sellExchange(), sell);

        BigDecimal soldQuantity = sell.filledQuantity();
        BigDecimal buyFee = buyOrder.fee();
        BigDecimal sellFee = sell.order() == null ? BigDecimal.ZERO : sell.order().fee();
        BigDecimal sellValue = sell.order() == null ? BigDecimal.ZERO : sell.order().filledValue();

        if (sell.isComplete(sellQuantity)) {
            handle.advance(ExecutionState.SELL_LEG_FILLED);
            checkSlippage(result, handle, pair, "sell", opportunity.sellPrice(), sell.order().averageFillPrice(), rules);
            BigDecimal buyValue = buyOrder.filledValue();
            BigDecimal fees = buyFee.add(sellFee);
            BigDecimal net = sellValue.subtract(buyValue).subtract(fees);
            handle.advance(ExecutionState.COMPLETED);
            boolean fullBuy = buyOrder.filledQuantity().compareTo(opportunity.suggestedQuantity()) >= 0;
            return result.status(fullBuy ? TradeResultStatus.SUCCESS : TradeResultStatus.PARTIAL_SUCCESS)
                .executionState(ExecutionState.COMPLETED)
                .actualBuyValue(buyValue)
                .actualSellValue(sellValue)
                .totalFees(fees)
                .netPnl(net)
                .pnlPercent(percentOf(net, buyValue))
                .errorMessage(fullBuy ? null : "Buy leg partially filled " + buyOrder.filledQuantity()
                    + "/" + opportunity.suggestedQuantity())
                .build();
        }

        // ═══════════════════════════════════════════════════════════════════════
        // SELL LEG FAILED: inventory is now held on the buy exchange
        // ═══════════════════════════════════════════════════════════════════════
        handle.advance(ExecutionState.PARTIAL_FAILURE);
        BigDecimal heldQuantity = sellQuantity.subtract(soldQuantity);
        HeldInventory held = new HeldInventory(handle.tradeId(), pair.symbol(), opportunity.buyExchange(),
            pair.baseCurrency(), heldQuantity, buyOrder.averageFillPrice(), Instant.now());
        stranded.track(held);

        // P&L covers only the matched quantity; held inventory is valued separately.
        BigDecimal matchedBuyValue = buyOrder.averageFillPrice().multiply(soldQuantity);
        BigDecimal matchedBuyFee = buyFee.multiply(soldQuantity)
            .divide(buyOrder.filledQuantity(), 8, RoundingMode.HALF_UP);
        BigDecimal net = sellValue.subtract(matchedBuyValue).subtract(matchedBuyFee).subtract(sellFee);
        String reason = sell.error() != null ? sell.error() : "Sell leg incomplete";

        publishError(new EngineError(SOURCE,
            String.format("Sell leg failed after buy filled: %s. Holding %s %s on %s", reason,
                heldQuantity.toPlainString(), pair.baseCurrency(), opportunity.buyExchange()),
            ErrorSeverity.CRITICAL, pair.symbol(), handle.tradeId(),
            String.format("Sell or transfer %s %s on %s manually", heldQuantity.toPlainString(),
                pair.baseCurrency(), opportunity.buyExchange()),
            held, null, Instant.now()));

        return result.status(TradeResultStatus.SELL_LEG_FAILED)
            .executionState(ExecutionState.PARTIAL_FAILURE)
            .actualBuyValue(buyOrder.filledValue())
            .actualSellValue(sellValue)
            .totalFees(buyFee.add(sellFee))
            .netPnl(net)
            .pnlPercent(percentOf(net, matchedBuyValue))
            .heldInventory(held)
            .errorMessage(reason)
            .build();
    }

    private void checkSlippage(TradeResult.Builder result, ExecutionHandle handle, TradingPair pair, String leg,
                               BigDecimal expected, BigDecimal actual, AdvancedRules rules) {
        if (expected == null || expected.signum() <= 0 || actual == null || actual.signum() <= 0) {
            return;
        }
        // Positive means worse than expected on either side.
        BigDecimal slippage = "buy".equals(leg)
            ? percentOf(actual.subtract(expected), expected)
            : percentOf(expected.subtract(actual), expected);
        result.metadata(leg + "SlippagePercent", slippage.setScale(6, RoundingMode.HALF_UP));
        if (rules.enableSlippageProtection()
            && slippage.compareTo(BigDecimal.valueOf(rules.maxSlippagePercent())) > 0) {
            result.metadata(leg + "SlippageExceeded", true);
            publishError(new EngineError(SOURCE, String.format("%s slippage %.4f%% above limit %s%%",
                leg, slippage, BigDecimal.valueOf(rules.maxSlippagePercent()).toPlainString()),
                ErrorSeverity.MEDIUM, pair.symbol(), handle.tradeId(), null, null, null, Instant.now()));
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    private void finish(ExecutionHandle handle, TradeResult result) {
        inFlight.remove(handle.symbol(), handle);
        metrics.setInFlightExecutions(inFlight.size());
        if (result.status() != TradeResultStatus.CANCELLED) {
            log.info("[EXEC] {} {} finished {} net={} in {}ms", result.tradeId(), result.symbol(),
                result.status(), result.netPnl(), result.duration().toMillis());
        }
        handle.result().complete(result);
    }

    private TradeResult cancelled(ExecutionHandle handle, SpreadOpportunity opportunity, String reason) {
        log.debug("[EXEC] {} cancelled: {}", opportunity.symbol(), reason);
        return TradeResult.builder()
            .tradeId(handle.tradeId())
            .opportunity(opportunity)
            .status(TradeResultStatus.CANCELLED)
            .executionState(ExecutionState.FAILED)
            .startedAt(handle.startedAt())
            .errorMessage(reason)
            .build();
    }

    /**
     * A leg that carried on after one of its orders could not be confirmed final.
     */
    private void reportUnsettled(TradingPair pair, ExecutionHandle handle, String exchange, LegOutcome leg) {
        if (!leg.hasUnsettledOrders()) {
            return;
        }
        publishError(new EngineError(SOURCE,
            String.format("Order(s) %s on %s not confirmed final and may still fill", leg.unsettledOrderIds(), exchange),
            ErrorSeverity.HIGH, pair.symbol(), handle.tradeId(), verifyOrders(exchange, leg), null, null,
            Instant.now()));
    }

    private static String verifyOrders(String exchange, LegOutcome leg) {
        return "Check order(s) " + String.join(", ", leg.unsettledOrderIds()) + " on " + exchange
            + " and cancel any still working";
    }

    private void publishError(EngineError error) {
        events.publish(EventType.ERROR_OCCURRED, l -> l.onError(error));
    }

    private static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, 6, RoundingMode.HALF_UP);
    }
}
