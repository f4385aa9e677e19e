package in.spreadarb.domain.balance;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Cross-exchange balance view. Superseded by the next snapshot, never mutated.
 *
 * {@code totalEquity} includes realized P&L recorded since the balances were fetched.
 */
public record CombinedBalanceSnapshot(
    Instant timestamp,
    Map<String, AccountBalance> accounts,
    Map<String, CombinedAssetBalance> assets,
    BigDecimal totalEquity,
    BigDecimal peakEquity,
    BigDecimal drawdownPercent,
    BigDecimal realizedPnl
) {
    public CombinedBalanceSnapshot {
        accounts = Map.copyOf(accounts);
        assets = Map.copyOf(assets);
    }

    public static CombinedBalanceSnapshot empty() {
        return new CombinedBalanceSnapshot(Instant.EPOCH, Map.of(), Map.of(),
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public boolean isEmpty() {
        return accounts.isEmpty();
    }

    /**
     * Available amount of {@code asset} on {@code exchange}; zero when unknown.
     */
    public BigDecimal available(String exchange, String asset) {
        AccountBalance account = accounts.get(exchange);
        return account == null ? BigDecimal.ZERO : account.available(asset);
    }
}
