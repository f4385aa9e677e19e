package in.spreadarb.service.balance;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Equity and drawdown arithmetic.
 *
 * Drawdown% = (peak - current) / peak * 100, clamped to [0, 100].
 * Peak = max(equity over the run).
 */
public final class EquityMath {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static BigDecimal drawdownPercent(BigDecimal peak, BigDecimal current) {
        if (peak == null || current == null || peak.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal drawdown = peak.subtract(current).multiply(HUNDRED).divide(peak, 6, RoundingMode.HALF_UP);
        if (drawdown.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return drawdown.min(HUNDRED);
    }

    public static BigDecimal newPeak(BigDecimal peak, BigDecimal current) {
        if (peak == null) return current;
        return current.compareTo(peak) > 0 ? current : peak;
    }

    /**
     * Return on {@code starting} in percent; zero when starting equity is not positive.
     */
    public static BigDecimal returnPercent(BigDecimal starting, BigDecimal pnl) {
        if (starting == null || starting.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return pnl.multiply(HUNDRED).divide(starting, 6, RoundingMode.HALF_UP);
    }

    private EquityMath() {}
}
