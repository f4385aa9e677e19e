package in.spreadarb.service.opportunity;

import in.spreadarb.domain.strategy.ExitRules;
import in.spreadarb.domain.trade.ExitReason;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;

/**
 * Exit conditions for inventory left behind by a failed sell leg.
 *
 * Checked in order: take profit, stop loss, trailing stop, maximum hold time.
 */
public final class ExitEvaluator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static Optional<ExitReason> evaluate(ExitRules rules,
                                                BigDecimal entryPrice,
                                                BigDecimal highestPrice,
                                                BigDecimal currentPrice,
                                                Duration held) {
        if (entryPrice == null || entryPrice.signum() <= 0 || currentPrice == null) {
            return Optional.empty();
        }
        BigDecimal pnl = pnlPercent(entryPrice, currentPrice);

        if (pnl.compareTo(BigDecimal.valueOf(rules.takeProfitPercent())) >= 0) {
            return Optional.of(ExitReason.TAKE_PROFIT);
        }
        if (pnl.compareTo(BigDecimal.valueOf(rules.stopLossPercent()).negate()) <= 0) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (rules.enableTrailingStop() && highestPrice != null) {
            BigDecimal peakPnl = pnlPercent(entryPrice, highestPrice);
            if (peakPnl.compareTo(BigDecimal.valueOf(rules.trailingStopActivationPercent())) >= 0) {
                BigDecimal stop = highestPrice.multiply(
                    BigDecimal.ONE.subtract(BigDecimal.valueOf(rules.trailingStopDistancePercent())
                        .divide(HUNDRED, 10, RoundingMode.HALF_UP)));
                if (currentPrice.compareTo(stop) <= 0) {
                    return Optional.of(ExitReason.TRAILING_STOP);
                }
            }
        }
        if (rules.maxHoldTimeMinutes() > 0 && held.compareTo(Duration.ofMinutes(rules.maxHoldTimeMinutes())) >= 0) {
            return Optional.of(ExitReason.MAX_HOLD_TIME);
        }
        return Optional.empty();
    }

    public static BigDecimal pnlPercent(BigDecimal entryPrice, BigDecimal currentPrice) {
        return currentPrice.subtract(entryPrice).multiply(HUNDRED).divide(entryPrice, 10, RoundingMode.HALF_UP);
    }

    private ExitEvaluator() {}
}
