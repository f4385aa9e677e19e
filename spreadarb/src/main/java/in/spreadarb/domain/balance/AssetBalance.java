package in.spreadarb.domain.balance;

import java.math.BigDecimal;

/**
 * Balance of one asset on one exchange.
 */
public record AssetBalance(String asset, BigDecimal total, BigDecimal available) {
    public AssetBalance {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("asset cannot be blank");
        }
        if (total == null) total = BigDecimal.ZERO;
        if (available == null) available = total;
    }

    public BigDecimal locked() {
        return total.subtract(available).max(BigDecimal.ZERO);
    }
}
