package in.spreadarb.domain.balance;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One asset merged across every exchange in the pool.
 *
 * {@code sharePercent} holds each exchange's share of the combined total.
 * {@code maxShareDeviationPercent} is the largest distance of any share from an even split.
 */
public record CombinedAssetBalance(
    String asset,
    Map<String, BigDecimal> totalByExchange,
    Map<String, BigDecimal> availableByExchange,
    BigDecimal total,
    BigDecimal available,
    BigDecimal priceInQuote,
    BigDecimal valueInQuote,
    Map<String, BigDecimal> sharePercent,
    BigDecimal maxShareDeviationPercent
) {
    public CombinedAssetBalance {
        totalByExchange = Map.copyOf(totalByExchange);
        availableByExchange = Map.copyOf(availableByExchange);
        sharePercent = Map.copyOf(sharePercent);
    }

    public BigDecimal totalOn(String exchange) {
        return totalByExchange.getOrDefault(exchange, BigDecimal.ZERO);
    }
}
