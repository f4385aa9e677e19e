package in.spreadarb.application.port.input;

import in.spreadarb.config.EngineConfig;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.pair.TradingPair;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.domain.trade.DailyStats;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.util.CancellationToken;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Public surface of the arbitrage engine.
 *
 * Lifecycle calls never throw for expected failures: they complete with the resulting
 * status, and failures surface as {@link EngineError} events. Invalid arguments throw
 * {@link IllegalArgumentException}.
 */
public interface ArbitrageEngine {

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    default CompletableFuture<EngineStatus> start() {
        return start(CancellationToken.none());
    }

    /**
     * Start the engine. Cancelling {@code token} stops it.
     * Completes with RUNNING, ERROR, or the current status when already started.
     */
    CompletableFuture<EngineStatus> start(CancellationToken token);

    /**
     * Stop polling and wait for in-flight executions up to the shutdown grace period.
     */
    CompletableFuture<EngineStatus> stop();

    EngineStatus pause();

    EngineStatus resume();

    EngineStatus status();

    Optional<EngineError> lastError();

    // ═══════════════════════════════════════════════════════════════════════
    // PAIRS
    // ═══════════════════════════════════════════════════════════════════════

    void addTradingPair(TradingPair pair);

    boolean removeTradingPair(String symbol);

    /**
     * Enable or disable a registered pair. Returns false for an unknown symbol.
     */
    boolean setPairEnabled(String symbol, boolean enabled);

    List<TradingPair> getTradingPairs();

    // ═══════════════════════════════════════════════════════════════════════
    // ON-DEMAND
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Fetch fresh quotes for {@code pair} and evaluate them once. Never fails; unusable
     * market data yields a non-tradeable opportunity.
     */
    CompletableFuture<SpreadOpportunity> analyzeOpportunity(TradingPair pair);

    /**
     * Execute an opportunity through the same per-pair lock the engine uses.
     */
    CompletableFuture<TradeResult> executeArbitrage(SpreadOpportunity opportunity);

    // ═══════════════════════════════════════════════════════════════════════
    // CONFIGURATION AND STATS
    // ═══════════════════════════════════════════════════════════════════════

    void updateConfig(EngineConfig config);

    void reloadStrategy(TradingStrategy strategy);

    void resetDailyStats();

    DailyStats getTodayStats();

    List<TradeResult> getTradeHistory(int count);

    BalancePoolService balancePool();

    void addListener(EngineEventListener listener);

    void removeListener(EngineEventListener listener);
}
