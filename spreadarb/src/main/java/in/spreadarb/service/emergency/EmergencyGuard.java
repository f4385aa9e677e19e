package in.spreadarb.service.emergency;

import in.spreadarb.config.EmergencySettings;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.strategy.RiskRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Evaluates the emergency rules in priority order and returns the first that fires.
 *
 * Order: drawdown (STOP), daily loss (STOP), consecutive losses (PAUSE),
 * rapid loss rate (PAUSE), critical imbalance (PAUSE).
 * Pure: acting on the result is the engine's job.
 */
public final class EmergencyGuard {
    private static final Logger log = LoggerFactory.getLogger(EmergencyGuard.class);

    private final Supplier<EmergencySettings> settings;
    private final List<EmergencyRule> rules;

    public EmergencyGuard(Supplier<EmergencySettings> settings) {
        this(settings, List.of(
            new DrawdownRule(),
            new DailyLossRule(),
            new ConsecutiveLossRule(),
            new RapidLossRule(),
            new CriticalImbalanceRule()));
    }

    EmergencyGuard(Supplier<EmergencySettings> settings, List<EmergencyRule> rules) {
        this.settings = settings;
        this.rules = List.copyOf(rules);
    }

    public Optional<EmergencyCheck> check(GuardInput input, RiskRules risk) {
        EmergencySettings current = settings.get();
        if (!current.enabled()) {
            return Optional.empty();
        }
        for (EmergencyRule rule : rules) {
            Optional<EmergencyCheck> check = rule.evaluate(input, risk, current);
            if (check.isPresent()) {
                log.debug("[GUARD] {} -> {}", check.get().reason(), check.get().action());
                return check;
            }
        }
        return Optional.empty();
    }
}
