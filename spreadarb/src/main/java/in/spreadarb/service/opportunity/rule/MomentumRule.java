package in.spreadarb.service.opportunity.rule;

import in.spreadarb.service.market.PriceHistory;
import in.spreadarb.service.opportunity.EntryContext;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Rejects when either leg moved against the trade by more than the net spread over the
 * momentum period: the sell side falling or the buy side rising.
 * Passes when there is not enough history yet.
 */
public final class MomentumRule implements EntryRule {
    private final Duration period;

    public MomentumRule(int periodMinutes) {
        this.period = Duration.ofMinutes(periodMinutes);
    }

    @Override
    public Optional<String> check(EntryContext context) {
        BigDecimal net = context.netSpreadPercent();
        Optional<BigDecimal> sellChange = change(context.sellHistory(), context);
        if (sellChange.isPresent() && sellChange.get().negate().compareTo(net) > 0) {
            return Optional.of(String.format("Sell price on %s fell %.4f%% over %d min",
                context.sellTicker().exchange(), sellChange.get().negate(), period.toMinutes()));
        }
        Optional<BigDecimal> buyChange = change(context.buyHistory(), context);
        if (buyChange.isPresent() && buyChange.get().compareTo(net) > 0) {
            return Optional.of(String.format("Buy price on %s rose %.4f%% over %d min",
                context.buyTicker().exchange(), buyChange.get(), period.toMinutes()));
        }
        return Optional.empty();
    }

    private Optional<BigDecimal> change(PriceHistory history, EntryContext context) {
        return history == null ? Optional.empty() : history.changePercent(period, context.now());
    }
}
