package in.spreadarb.domain.balance;

import java.math.BigDecimal;

/**
 * Equity-level P&L of the balance pool since initialization.
 */
public record PoolPnl(
    BigDecimal startingEquity,
    BigDecimal currentEquity,
    BigDecimal realizedPnl,
    BigDecimal pnlPercent,
    BigDecimal peakEquity,
    BigDecimal currentDrawdownPercent,
    BigDecimal maxDrawdownPercent
) {}
