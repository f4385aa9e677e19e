package in.spreadarb.domain.order;

/**
 * Exchange order status.
 */
public enum OrderStatus {
    NEW,                // Accepted, nothing filled yet
    PARTIALLY_FILLED,   // Some quantity filled, order still working
    FILLED,             // Completely filled
    CANCELLED,          // Cancelled by us or the exchange (may carry a partial fill)
    REJECTED;           // Refused by the exchange

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }
}
