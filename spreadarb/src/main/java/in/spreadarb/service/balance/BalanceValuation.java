package in.spreadarb.service.balance;

import in.spreadarb.application.port.output.PriceOracle;
import in.spreadarb.domain.balance.AccountBalance;
import in.spreadarb.domain.balance.AssetBalance;
import in.spreadarb.domain.balance.CombinedAssetBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines per-exchange balances into per-asset totals valued in one currency.
 *
 * Share percentages are taken over every exchange in the pool, so an asset missing on
 * one exchange counts as a 0% share there. Assets without a price are listed with zero value.
 */
public final class BalanceValuation {
    private static final Logger log = LoggerFactory.getLogger(BalanceValuation.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public record Valuation(Map<String, CombinedAssetBalance> assets, BigDecimal totalEquity) {}

    public static Valuation value(Map<String, AccountBalance> accounts, PriceOracle prices, String valuationCurrency) {
        TreeSet<String> assetNames = new TreeSet<>();
        accounts.values().forEach(account -> assetNames.addAll(account.assets().keySet()));

        Map<String, CombinedAssetBalance> combined = new TreeMap<>();
        BigDecimal equity = BigDecimal.ZERO;
        int exchangeCount = accounts.size();
        BigDecimal evenShare = exchangeCount == 0 ? BigDecimal.ZERO
            : HUNDRED.divide(BigDecimal.valueOf(exchangeCount), 6, RoundingMode.HALF_UP);

        for (String asset : assetNames) {
            Map<String, BigDecimal> totals = new HashMap<>();
            Map<String, BigDecimal> available = new HashMap<>();
            BigDecimal total = BigDecimal.ZERO;
            BigDecimal free = BigDecimal.ZERO;
            for (AccountBalance account : accounts.values()) {
                AssetBalance balance = account.asset(asset);
                totals.put(account.exchange(), balance.total());
                available.put(account.exchange(), balance.available());
                total = total.add(balance.total());
                free = free.add(balance.available());
            }

            Map<String, BigDecimal> shares = new HashMap<>();
            BigDecimal maxDeviation = BigDecimal.ZERO;
            if (total.signum() > 0) {
                for (Map.Entry<String, BigDecimal> entry : totals.entrySet()) {
                    BigDecimal share = entry.getValue().multiply(HUNDRED).divide(total, 6, RoundingMode.HALF_UP);
                    shares.put(entry.getKey(), share);
                    maxDeviation = maxDeviation.max(share.subtract(evenShare).abs());
                }
            }

            BigDecimal price = prices.priceIn(asset, valuationCurrency).orElse(null);
            BigDecimal value = BigDecimal.ZERO;
            if (price == null) {
                if (total.signum() > 0) {
                    log.debug("[BALANCE] No {} price for {}, valued at zero", valuationCurrency, asset);
                }
                price = BigDecimal.ZERO;
            } else {
                value = total.multiply(price).setScale(8, RoundingMode.HALF_UP);
            }
            equity = equity.add(value);
            combined.put(asset, new CombinedAssetBalance(asset, totals, available, total, free, price, value,
                shares, maxDeviation));
        }
        return new Valuation(combined, equity);
    }

    private BalanceValuation() {}
}
