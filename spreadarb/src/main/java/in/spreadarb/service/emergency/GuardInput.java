package in.spreadarb.service.emergency;

import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.trade.TradeResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Pool state the emergency rules evaluate.
 *
 * @param recentTrades executed trades since the last acknowledged loss streak, oldest first
 * @param dailyLoss    today's realized loss as a positive number, zero when in profit
 */
public record GuardInput(
    Instant now,
    BigDecimal drawdownPercent,
    BigDecimal dailyLoss,
    BigDecimal startingEquity,
    List<TradeResult> recentTrades,
    CombinedBalanceSnapshot snapshot,
    Set<String> tradedAssets,
    double rebalanceThresholdPercent
) {
    public GuardInput {
        recentTrades = recentTrades == null ? List.of() : List.copyOf(recentTrades);
        tradedAssets = tradedAssets == null ? Set.of() : Set.copyOf(tradedAssets);
    }
}
