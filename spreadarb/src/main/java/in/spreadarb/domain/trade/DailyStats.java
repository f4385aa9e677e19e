package in.spreadarb.domain.trade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Per-day trading counters (UTC day).
 */
public record DailyStats(
    LocalDate date,
    int totalTrades,
    int successfulTrades,
    int failedTrades,
    BigDecimal totalNetPnl,
    BigDecimal totalProfit,
    BigDecimal totalLoss,
    BigDecimal totalFees,
    BigDecimal totalVolume
) {
    public static DailyStats empty(LocalDate date) {
        return new DailyStats(date, 0, 0, 0,
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    /**
     * Stats with one more trade folded in.
     */
    public DailyStats plus(TradeResult trade) {
        boolean success = trade.status().executedBothLegs();
        BigDecimal pnl = trade.netPnl();
        return new DailyStats(
            date,
            totalTrades + 1,
            successfulTrades + (success ? 1 : 0),
            failedTrades + (success ? 0 : 1),
            totalNetPnl.add(pnl),
            pnl.signum() > 0 ? totalProfit.add(pnl) : totalProfit,
            pnl.signum() < 0 ? totalLoss.add(pnl.abs()) : totalLoss,
            totalFees.add(trade.totalFees()),
            totalVolume.add(trade.actualBuyValue()));
    }

    /**
     * Successful trades as a percentage of all trades.
     */
    public BigDecimal winRate() {
        if (totalTrades == 0) return BigDecimal.ZERO;
        return BigDecimal.valueOf(successfulTrades)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(totalTrades), 2, RoundingMode.HALF_UP);
    }

    public BigDecimal averagePnlPerTrade() {
        if (totalTrades == 0) return BigDecimal.ZERO;
        return totalNetPnl.divide(BigDecimal.valueOf(totalTrades), 8, RoundingMode.HALF_UP);
    }
}
