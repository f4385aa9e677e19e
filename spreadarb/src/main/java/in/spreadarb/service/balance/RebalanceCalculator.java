package in.spreadarb.service.balance;

import in.spreadarb.domain.balance.CombinedAssetBalance;
import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.balance.RebalanceAction;
import in.spreadarb.domain.balance.RebalanceRecommendation;
import in.spreadarb.domain.balance.RebalanceUrgency;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Suggests transfers that move each traded asset back towards an even split.
 *
 * Urgency by the largest share deviation from an even split:
 * - above 40 points: CRITICAL
 * - above 35 points: HIGH
 * - above the configured threshold (30 by default): MEDIUM
 *
 * One action per asset: from the exchange with the largest share to the one with the smallest.
 */
public final class RebalanceCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    static final BigDecimal HIGH_DEVIATION = BigDecimal.valueOf(35);
    static final BigDecimal CRITICAL_DEVIATION = BigDecimal.valueOf(40);

    /**
     * @param assets assets to consider; null means all
     */
    public static RebalanceRecommendation calculate(CombinedBalanceSnapshot snapshot, double thresholdPercent,
                                                    Set<String> assets) {
        if (snapshot == null || snapshot.isEmpty() || snapshot.accounts().size() < 2) {
            return RebalanceRecommendation.balanced();
        }
        BigDecimal threshold = BigDecimal.valueOf(thresholdPercent);
        BigDecimal evenShare = HUNDRED.divide(BigDecimal.valueOf(snapshot.accounts().size()), 6, RoundingMode.HALF_UP);
        List<RebalanceAction> actions = new ArrayList<>();

        for (CombinedAssetBalance asset : snapshot.assets().values()) {
            if (assets != null && !assets.contains(asset.asset())) continue;
            if (asset.total().signum() <= 0) continue;
            BigDecimal deviation = asset.maxShareDeviationPercent();
            if (deviation.compareTo(threshold) <= 0) continue;

            String from = null;
            String to = null;
            BigDecimal maxShare = null;
            BigDecimal minShare = null;
            for (Map.Entry<String, BigDecimal> share : asset.sharePercent().entrySet()) {
                if (maxShare == null || share.getValue().compareTo(maxShare) > 0) {
                    maxShare = share.getValue();
                    from = share.getKey();
                }
                if (minShare == null || share.getValue().compareTo(minShare) < 0) {
                    minShare = share.getValue();
                    to = share.getKey();
                }
            }
            if (from == null || from.equals(to)) continue;

            BigDecimal amount = asset.total().multiply(maxShare.subtract(evenShare))
                .divide(HUNDRED, 8, RoundingMode.DOWN);
            BigDecimal value = amount.multiply(asset.priceInQuote()).setScale(2, RoundingMode.HALF_UP);
            RebalanceUrgency urgency = urgencyFor(deviation);
            actions.add(new RebalanceAction(asset.asset(), from, to, amount, value, urgency,
                String.format("%s is %.1f%% on %s, %.1f points from an even split", asset.asset(), maxShare,
                    from, deviation)));
        }
        return actions.isEmpty() ? RebalanceRecommendation.balanced() : RebalanceRecommendation.of(actions);
    }

    static RebalanceUrgency urgencyFor(BigDecimal deviation) {
        if (deviation.compareTo(CRITICAL_DEVIATION) > 0) return RebalanceUrgency.CRITICAL;
        if (deviation.compareTo(HIGH_DEVIATION) > 0) return RebalanceUrgency.HIGH;
        return RebalanceUrgency.MEDIUM;
    }

    private RebalanceCalculator() {}
}
