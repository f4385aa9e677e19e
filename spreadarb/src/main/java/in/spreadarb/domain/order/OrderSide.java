package in.spreadarb.domain.order;

/**
 * Order side.
 */
public enum OrderSide {
    BUY,
    SELL
}
