package in.spreadarb.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Immutable result of one detection cycle for a pair.
 *
 * All spread figures are in percent (0.10 means 0.10%).
 */
public record SpreadOpportunity(
    String symbol,
    ArbitrageDirection direction,
    String buyExchange,
    String sellExchange,
    BigDecimal buyPrice,
    BigDecimal sellPrice,
    BigDecimal grossSpreadPercent,
    BigDecimal feePercent,
    BigDecimal slippagePercent,
    BigDecimal netSpreadPercent,
    BigDecimal expectedNetProfit,
    BigDecimal suggestedQuantity,
    boolean shouldTrade,
    List<String> rejectionReasons,
    Instant detectedAt
) {
    public SpreadOpportunity {
        if (symbol == null || direction == null) {
            throw new IllegalArgumentException("symbol and direction are required");
        }
        if (grossSpreadPercent == null) grossSpreadPercent = BigDecimal.ZERO;
        if (feePercent == null) feePercent = BigDecimal.ZERO;
        if (slippagePercent == null) slippagePercent = BigDecimal.ZERO;
        if (netSpreadPercent == null) netSpreadPercent = BigDecimal.ZERO;
        if (expectedNetProfit == null) expectedNetProfit = BigDecimal.ZERO;
        if (suggestedQuantity == null) suggestedQuantity = BigDecimal.ZERO;
        rejectionReasons = rejectionReasons == null ? List.of() : List.copyOf(rejectionReasons);
        if (detectedAt == null) detectedAt = Instant.now();
        if (shouldTrade && (direction == ArbitrageDirection.NONE || suggestedQuantity.signum() <= 0)) {
            throw new IllegalArgumentException("A tradeable opportunity needs a direction and a positive quantity");
        }
    }

    /**
     * Non-tradeable result for a cycle where market data was unusable.
     */
    public static SpreadOpportunity none(String symbol, String reason) {
        return new SpreadOpportunity(symbol, ArbitrageDirection.NONE, null, null, null, null,
            null, null, null, null, null, null, false, List.of(reason), Instant.now());
    }

    public boolean hasDirection() {
        return direction != ArbitrageDirection.NONE;
    }

    /**
     * Quote value of the suggested trade at the buy price.
     */
    public BigDecimal notional() {
        return buyPrice == null ? BigDecimal.ZERO : buyPrice.multiply(suggestedQuantity);
    }
}
