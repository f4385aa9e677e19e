package in.spreadarb.service.opportunity.rule;

import in.spreadarb.service.opportunity.EntryContext;

import java.time.Duration;
import java.util.Optional;

/**
 * The spread must have held in the same direction for a number of consecutive cycles
 * and for a minimum time.
 */
public final class SpreadConfirmationRule implements EntryRule {
    private final int required;
    private final Duration minDuration;

    public SpreadConfirmationRule(int requiredConfirmations, int confirmationSeconds) {
        this.required = requiredConfirmations;
        this.minDuration = Duration.ofSeconds(confirmationSeconds);
    }

    @Override
    public Optional<String> check(EntryContext context) {
        if (context.confirmations() < required) {
            return Optional.of(String.format("Spread seen %d of %d required times",
                context.confirmations(), required));
        }
        if (context.confirmedFor().compareTo(minDuration) < 0) {
            return Optional.of(String.format("Spread held %dms, needs %ds",
                context.confirmedFor().toMillis(), minDuration.getSeconds()));
        }
        return Optional.empty();
    }
}
