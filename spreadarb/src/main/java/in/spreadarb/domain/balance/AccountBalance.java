package in.spreadarb.domain.balance;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * All asset balances held on one exchange at a point in time.
 */
public record AccountBalance(String exchange, Map<String, AssetBalance> assets, Instant timestamp) {
    public AccountBalance {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        assets = assets == null ? Map.of() : Map.copyOf(assets);
        if (timestamp == null) timestamp = Instant.now();
    }

    public AssetBalance asset(String asset) {
        AssetBalance balance = assets.get(asset);
        return balance != null ? balance : new AssetBalance(asset, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public BigDecimal available(String asset) {
        return asset(asset).available();
    }
}
