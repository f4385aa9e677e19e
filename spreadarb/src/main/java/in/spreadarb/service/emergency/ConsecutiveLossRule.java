package in.spreadarb.service.emergency;

import in.spreadarb.config.EmergencySettings;
import in.spreadarb.domain.emergency.EmergencyAction;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.strategy.RiskRules;
import in.spreadarb.domain.trade.TradeResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Pauses trading after N losing trades in a row.
 */
final class ConsecutiveLossRule implements EmergencyRule {

    @Override
    public Optional<EmergencyCheck> evaluate(GuardInput input, RiskRules risk, EmergencySettings settings) {
        int limit = risk.maxConsecutiveLosses();
        if (limit <= 0) {
            return Optional.empty();
        }
        int streak = trailingLosses(input.recentTrades());
        if (streak < limit) {
            return Optional.empty();
        }
        return Optional.of(EmergencyCheck.of(EmergencyTriggerReason.CONSECUTIVE_LOSSES, EmergencyAction.PAUSE_TRADING,
            BigDecimal.valueOf(streak), BigDecimal.valueOf(limit),
            streak + " consecutive losing trades (limit " + limit + ")"));
    }

    static int trailingLosses(List<TradeResult> trades) {
        int streak = 0;
        for (int i = trades.size() - 1; i >= 0; i--) {
            if (!trades.get(i).isLoss()) break;
            streak++;
        }
        return streak;
    }
}
