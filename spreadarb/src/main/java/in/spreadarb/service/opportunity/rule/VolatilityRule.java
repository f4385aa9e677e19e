package in.spreadarb.service.opportunity.rule;

import in.spreadarb.service.market.PriceHistory;
import in.spreadarb.service.opportunity.EntryContext;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * High/low range of either leg over the period must stay under the limit.
 */
public final class VolatilityRule implements EntryRule {
    private final BigDecimal maxPercent;
    private final Duration period;

    public VolatilityRule(double maxVolatilityPercent, int periodMinutes) {
        this.maxPercent = BigDecimal.valueOf(maxVolatilityPercent);
        this.period = Duration.ofMinutes(periodMinutes);
    }

    @Override
    public Optional<String> check(EntryContext context) {
        Optional<String> buy = check(context.buyHistory(), context.buyTicker().exchange(), context);
        return buy.isPresent() ? buy : check(context.sellHistory(), context.sellTicker().exchange(), context);
    }

    private Optional<String> check(PriceHistory history, String exchange, EntryContext context) {
        if (history == null) {
            return Optional.empty();
        }
        return history.rangePercent(period, context.now())
            .filter(range -> range.compareTo(maxPercent) > 0)
            .map(range -> String.format("Volatility on %s is %.4f%%, above %s%%",
                exchange, range, maxPercent.toPlainString()));
    }
}
