package in.spreadarb.service.opportunity.rule;

import in.spreadarb.service.opportunity.EntryContext;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Expected net profit at the suggested quantity must reach the floor, in quote currency.
 */
public final class MinProfitRule implements EntryRule {
    private final BigDecimal min;

    public MinProfitRule(double minExpectedProfit) {
        this.min = BigDecimal.valueOf(minExpectedProfit);
    }

    @Override
    public Optional<String> check(EntryContext context) {
        BigDecimal expected = context.expectedNetProfit();
        if (expected.compareTo(min) < 0) {
            return Optional.of(String.format("Expected profit %.4f below minimum %s",
                expected, min.toPlainString()));
        }
        return Optional.empty();
    }
}
