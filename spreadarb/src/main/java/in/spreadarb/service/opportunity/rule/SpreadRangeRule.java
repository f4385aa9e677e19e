package in.spreadarb.service.opportunity.rule;

import in.spreadarb.service.opportunity.EntryContext;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Net spread must sit in [min, max]. Spreads above max usually mean a broken quote.
 */
public final class SpreadRangeRule implements EntryRule {
    private final BigDecimal min;
    private final BigDecimal max;

    public SpreadRangeRule(double minPercent, double maxPercent) {
        this.min = BigDecimal.valueOf(minPercent);
        this.max = BigDecimal.valueOf(maxPercent);
    }

    @Override
    public Optional<String> check(EntryContext context) {
        BigDecimal net = context.netSpreadPercent();
        if (net.compareTo(min) < 0) {
            return Optional.of(String.format("Net spread %.4f%% below minimum %s%%", net, min.toPlainString()));
        }
        if (net.compareTo(max) > 0) {
            return Optional.of(String.format("Net spread %.4f%% above maximum %s%% (suspect quote)",
                net, max.toPlainString()));
        }
        return Optional.empty();
    }
}
