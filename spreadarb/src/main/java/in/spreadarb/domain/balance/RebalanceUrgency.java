package in.spreadarb.domain.balance;

/**
 * How soon funds should be moved between exchanges.
 */
public enum RebalanceUrgency {
    NONE,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean atLeast(RebalanceUrgency other) {
        return compareTo(other) >= 0;
    }
}
