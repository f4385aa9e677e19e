package in.spreadarb.service.opportunity;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Spread arithmetic in percent.
 *
 * gross = (sellBid - buyAsk) / buyAsk * 100
 * net   = gross - buyFee - sellFee - estimatedSlippage
 */
public final class SpreadCalculator {

    static final int SCALE = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static BigDecimal grossSpreadPercent(BigDecimal buyAsk, BigDecimal sellBid) {
        if (buyAsk == null || buyAsk.signum() <= 0 || sellBid == null) {
            throw new IllegalArgumentException("buy price must be positive");
        }
        return sellBid.subtract(buyAsk).multiply(HUNDRED).divide(buyAsk, SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal netSpreadPercent(BigDecimal grossPercent, BigDecimal totalFeePercent,
                                              BigDecimal slippagePercent) {
        return grossPercent.subtract(totalFeePercent).subtract(slippagePercent);
    }

    /**
     * Expected profit in quote currency for {@code quantity} bought at {@code buyPrice}.
     */
    public static BigDecimal expectedProfit(BigDecimal quantity, BigDecimal buyPrice, BigDecimal netPercent) {
        return quantity.multiply(buyPrice).multiply(netPercent).divide(HUNDRED, 8, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, SCALE, RoundingMode.HALF_UP);
    }

    private SpreadCalculator() {}
}
