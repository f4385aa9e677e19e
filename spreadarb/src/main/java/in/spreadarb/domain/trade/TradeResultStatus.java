package in.spreadarb.domain.trade;

/**
 * Overall outcome of an arbitrage attempt.
 */
public enum TradeResultStatus {
    SUCCESS,            // Both legs filled for the full quantity
    PARTIAL_SUCCESS,    // Both legs filled, for less than the suggested quantity
    SELL_LEG_FAILED,    // Buy inventory acquired, sell leg failed or timed out
    BUY_LEG_FAILED,     // Buy leg rejected or unfilled; nothing held
    CANCELLED,          // Not attempted (engine stopping, trading disabled)
    ERROR;              // Unexpected failure

    public boolean executedBothLegs() {
        return this == SUCCESS || this == PARTIAL_SUCCESS;
    }
}
