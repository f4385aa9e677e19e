package in.spreadarb.domain.common;

/**
 * Engine event types, as written to the event log.
 */
public enum EventType {
    STATUS_CHANGED,
    PRICE_UPDATED,
    OPPORTUNITY_FOUND,
    TRADE_COMPLETED,
    ERROR_OCCURRED,
    BALANCE_UPDATED,
    EMERGENCY_TRIGGERED,
    REBALANCE_RECOMMENDED,
    EXIT_SIGNAL
}
