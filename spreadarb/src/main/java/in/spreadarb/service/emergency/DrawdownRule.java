package in.spreadarb.service.emergency;

import in.spreadarb.config.EmergencySettings;
import in.spreadarb.domain.emergency.EmergencyAction;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.strategy.RiskRules;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Stops trading once pool drawdown reaches the strategy limit.
 */
final class DrawdownRule implements EmergencyRule {

    @Override
    public Optional<EmergencyCheck> evaluate(GuardInput input, RiskRules risk, EmergencySettings settings) {
        if (!risk.enableDrawdownProtection()) {
            return Optional.empty();
        }
        BigDecimal limit = BigDecimal.valueOf(risk.maxDrawdownPercent());
        if (input.drawdownPercent().compareTo(limit) < 0) {
            return Optional.empty();
        }
        return Optional.of(EmergencyCheck.of(EmergencyTriggerReason.MAX_DRAWDOWN_EXCEEDED, EmergencyAction.STOP_TRADING,
            input.drawdownPercent(), limit,
            String.format("Drawdown %.2f%% reached limit %s%%", input.drawdownPercent(), limit.toPlainString())));
    }
}
