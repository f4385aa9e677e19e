package in.spreadarb.domain.balance;

import java.math.BigDecimal;

/**
 * Suggested transfer of one asset between two exchanges.
 */
public record RebalanceAction(
    String asset,
    String fromExchange,
    String toExchange,
    BigDecimal amount,
    BigDecimal valueInQuote,
    RebalanceUrgency urgency,
    String reason
) {}
