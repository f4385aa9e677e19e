package in.spreadarb.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Inventory left on the buy exchange after a sell leg failed.
 */
public record HeldInventory(
    String tradeId,
    String symbol,
    String exchange,
    String asset,
    BigDecimal quantity,
    BigDecimal averageCost,
    Instant acquiredAt
) {
    public HeldInventory {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Held quantity must be positive");
        }
    }

    public BigDecimal costBasis() {
        return quantity.multiply(averageCost);
    }
}
