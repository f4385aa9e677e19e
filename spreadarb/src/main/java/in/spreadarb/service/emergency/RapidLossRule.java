package in.spreadarb.service.emergency;

import in.spreadarb.config.EmergencySettings;
import in.spreadarb.domain.emergency.EmergencyAction;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.strategy.RiskRules;
import in.spreadarb.domain.trade.TradeResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Pauses trading when trades inside the rapid-loss window lost more than a fraction of
 * starting equity. Needs a minimum number of trades in the window.
 */
final class RapidLossRule implements EmergencyRule {

    @Override
    public Optional<EmergencyCheck> evaluate(GuardInput input, RiskRules risk, EmergencySettings settings) {
        if (input.startingEquity() == null || input.startingEquity().signum() <= 0) {
            return Optional.empty();
        }
        Instant from = input.now().minusSeconds(settings.rapidLossWindowSeconds());
        int count = 0;
        BigDecimal pnl = BigDecimal.ZERO;
        for (TradeResult trade : input.recentTrades()) {
            if (trade.endedAt().isBefore(from)) continue;
            count++;
            pnl = pnl.add(trade.netPnl());
        }
        if (count < settings.rapidLossMinTrades() || pnl.signum() >= 0) {
            return Optional.empty();
        }
        BigDecimal loss = pnl.negate();
        BigDecimal limit = input.startingEquity()
            .multiply(BigDecimal.valueOf(settings.rapidLossThresholdPercent()))
            .divide(BigDecimal.valueOf(100), 8, RoundingMode.HALF_UP);
        if (loss.compareTo(limit) < 0) {
            return Optional.empty();
        }
        return Optional.of(EmergencyCheck.of(EmergencyTriggerReason.RAPID_LOSS_RATE, EmergencyAction.PAUSE_TRADING,
            loss, limit, String.format("Lost %.2f over %d trades in %ds (limit %.2f)", loss, count,
                settings.rapidLossWindowSeconds(), limit)));
    }
}
