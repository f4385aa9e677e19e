package in.spreadarb.service.emergency;

import in.spreadarb.config.EmergencySettings;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.strategy.RiskRules;

import java.util.Optional;

/**
 * One emergency condition.
 */
public interface EmergencyRule {

    Optional<EmergencyCheck> evaluate(GuardInput input, RiskRules risk, EmergencySettings settings);
}
