package in.spreadarb.application.port.input;

import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.balance.PoolPnl;
import in.spreadarb.domain.balance.RebalanceRecommendation;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.trade.TradeResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Cross-exchange balance pool: combined balances, equity, drawdown and emergency checks.
 *
 * Reads return the latest published snapshot without blocking. Mutations are serialized.
 */
public interface BalancePoolService {

    /**
     * Fetch balances from every exchange and reset starting and peak equity.
     */
    CompletableFuture<CombinedBalanceSnapshot> initialize();

    CompletableFuture<CombinedBalanceSnapshot> refresh();

    /**
     * Apply a finished trade's realized P&L right away, without waiting for a refresh.
     */
    CompletableFuture<CombinedBalanceSnapshot> recordTrade(TradeResult result);

    CombinedBalanceSnapshot currentSnapshot();

    /**
     * Drawdown from peak equity in percent, within [0, 100].
     */
    BigDecimal currentDrawdown();

    BigDecimal realizedPnl();

    /**
     * Largest drawdown seen since {@link #initialize()}.
     */
    BigDecimal maxDrawdown();

    PoolPnl pnl();

    /**
     * Most recent snapshots, newest first.
     */
    List<CombinedBalanceSnapshot> history(int count);

    RebalanceRecommendation calculateRebalance();

    /**
     * Evaluate the emergency rules against the current state without acting on them.
     */
    Optional<EmergencyCheck> checkEmergency();

    /**
     * Trades recorded so far no longer count towards loss streaks or the rapid-loss window.
     */
    void acknowledgeLossStreak();

    void resetDailyLoss();
}
