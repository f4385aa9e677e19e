package in.spreadarb.service.emergency;

import in.spreadarb.config.EmergencySettings;
import in.spreadarb.domain.emergency.EmergencyAction;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.strategy.RiskRules;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Stops trading once today's realized loss reaches the strategy limit.
 */
final class DailyLossRule implements EmergencyRule {

    @Override
    public Optional<EmergencyCheck> evaluate(GuardInput input, RiskRules risk, EmergencySettings settings) {
        BigDecimal limit = BigDecimal.valueOf(risk.maxDailyLoss());
        if (limit.signum() <= 0 || input.dailyLoss().compareTo(limit) < 0) {
            return Optional.empty();
        }
        return Optional.of(EmergencyCheck.of(EmergencyTriggerReason.MAX_DAILY_LOSS_EXCEEDED,
            EmergencyAction.STOP_TRADING, input.dailyLoss(), limit,
            String.format("Daily loss %.2f reached limit %s", input.dailyLoss(), limit.toPlainString())));
    }
}
