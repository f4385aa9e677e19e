package in.spreadarb.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Recommendation to close held inventory. Never acted on automatically.
 */
public record ExitSignal(
    HeldInventory inventory,
    ExitReason reason,
    BigDecimal currentPrice,
    BigDecimal pnlPercent,
    Instant generatedAt
) {}
