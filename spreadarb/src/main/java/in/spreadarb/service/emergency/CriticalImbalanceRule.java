package in.spreadarb.service.emergency;

import in.spreadarb.config.EmergencySettings;
import in.spreadarb.domain.balance.CombinedAssetBalance;
import in.spreadarb.domain.emergency.EmergencyAction;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.strategy.RiskRules;
import in.spreadarb.service.balance.RebalanceCalculator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Pauses trading when a traded asset sits almost entirely on one exchange.
 * The check carries the rebalance recommendation that would fix it.
 */
final class CriticalImbalanceRule implements EmergencyRule {

    @Override
    public Optional<EmergencyCheck> evaluate(GuardInput input, RiskRules risk, EmergencySettings settings) {
        if (input.snapshot() == null || input.snapshot().accounts().size() < 2) {
            return Optional.empty();
        }
        BigDecimal limit = BigDecimal.valueOf(settings.criticalImbalancePercent());
        CombinedAssetBalance worst = null;
        for (CombinedAssetBalance asset : input.snapshot().assets().values()) {
            if (!input.tradedAssets().contains(asset.asset()) || asset.total().signum() <= 0) continue;
            if (worst == null || asset.maxShareDeviationPercent().compareTo(worst.maxShareDeviationPercent()) > 0) {
                worst = asset;
            }
        }
        if (worst == null || worst.maxShareDeviationPercent().compareTo(limit) <= 0) {
            return Optional.empty();
        }
        return Optional.of(new EmergencyCheck(EmergencyTriggerReason.CRITICAL_IMBALANCE,
            String.format("%s deviates %.1f points from an even split (limit %s)", worst.asset(),
                worst.maxShareDeviationPercent(), limit.toPlainString()),
            worst.maxShareDeviationPercent(), limit, EmergencyAction.PAUSE_TRADING,
            RebalanceCalculator.calculate(input.snapshot(), input.rebalanceThresholdPercent(), input.tradedAssets()),
            Instant.now()));
    }
}
