package in.spreadarb.domain.emergency;

import in.spreadarb.domain.balance.RebalanceRecommendation;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A fired emergency rule. Broadcast, never persisted.
 */
public record EmergencyCheck(
    EmergencyTriggerReason reason,
    String message,
    BigDecimal currentValue,
    BigDecimal threshold,
    EmergencyAction action,
    RebalanceRecommendation rebalance,      // only for CRITICAL_IMBALANCE
    Instant checkedAt
) {
    public EmergencyCheck {
        if (reason == null || action == null) {
            throw new IllegalArgumentException("reason and action are required");
        }
        if (checkedAt == null) checkedAt = Instant.now();
    }

    public static EmergencyCheck of(EmergencyTriggerReason reason, EmergencyAction action,
                                    BigDecimal current, BigDecimal threshold, String message) {
        return new EmergencyCheck(reason, message, current, threshold, action, null, Instant.now());
    }
}
