package in.spreadarb.domain.trade;

/**
 * Which leg of a pair is bought and which is sold.
 */
public enum ArbitrageDirection {
    BUY_A_SELL_B,
    BUY_B_SELL_A,
    NONE
}
