package in.spreadarb.domain.order;

/**
 * Order type.
 */
public enum OrderType {
    MARKET,
    LIMIT
}
