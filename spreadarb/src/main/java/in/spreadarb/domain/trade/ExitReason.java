package in.spreadarb.domain.trade;

/**
 * Why an exit is recommended for held inventory.
 */
public enum ExitReason {
    TAKE_PROFIT,
    STOP_LOSS,
    TRAILING_STOP,
    MAX_HOLD_TIME
}
