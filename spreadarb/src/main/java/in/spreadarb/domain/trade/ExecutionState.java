package in.spreadarb.domain.trade;

/**
 * Progress of one two-leg execution attempt.
 *
 * PENDING -> BUY_LEG_SUBMITTED -> BUY_LEG_FILLED -> SELL_LEG_SUBMITTED -> SELL_LEG_FILLED -> COMPLETED.
 * PARTIAL_FAILURE when the buy leg filled and the sell leg did not fully complete.
 * FAILED when the attempt ended without acquiring any inventory.
 */
public enum ExecutionState {
    PENDING,
    BUY_LEG_SUBMITTED,
    BUY_LEG_FILLED,
    SELL_LEG_SUBMITTED,
    SELL_LEG_FILLED,
    COMPLETED,
    PARTIAL_FAILURE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL_FAILURE || this == FAILED;
    }

    /**
     * Past this point inventory may be held on the buy exchange,
     * so shutdown has to wait for the attempt to finish.
     */
    public boolean holdsInventoryRisk() {
        return this == BUY_LEG_SUBMITTED || this == BUY_LEG_FILLED
            || this == SELL_LEG_SUBMITTED || this == SELL_LEG_FILLED;
    }
}
