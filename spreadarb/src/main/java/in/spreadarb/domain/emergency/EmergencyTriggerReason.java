package in.spreadarb.domain.emergency;

/**
 * Emergency rules, in evaluation order.
 */
public enum EmergencyTriggerReason {
    MAX_DRAWDOWN_EXCEEDED,
    MAX_DAILY_LOSS_EXCEEDED,
    CONSECUTIVE_LOSSES,
    RAPID_LOSS_RATE,
    CRITICAL_IMBALANCE
}
