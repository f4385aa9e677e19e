package in.spreadarb.domain.market;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Top-of-book snapshot for one exchange and symbol.
 * Replaced on every poll; never mutated.
 */
public record Ticker(
    String exchange,
    String symbol,
    BigDecimal bid,
    BigDecimal bidQuantity,
    BigDecimal ask,
    BigDecimal askQuantity,
    BigDecimal last,
    BigDecimal volume24h,      // 24h volume in quote currency
    Instant timestamp
) {
    public Ticker {
        if (exchange == null || symbol == null) {
            throw new IllegalArgumentException("exchange and symbol cannot be null");
        }
        if (bid == null || ask == null || timestamp == null) {
            throw new IllegalArgumentException("bid, ask and timestamp cannot be null");
        }
        if (bidQuantity == null) bidQuantity = BigDecimal.ZERO;
        if (askQuantity == null) askQuantity = BigDecimal.ZERO;
        if (last == null) last = bid;
        if (volume24h == null) volume24h = BigDecimal.ZERO;
    }

    public BigDecimal mid() {
        return bid.add(ask).divide(BigDecimal.valueOf(2), 12, RoundingMode.HALF_UP);
    }

    /**
     * True when both sides carry a usable price.
     */
    public boolean hasPositivePrices() {
        return bid.signum() > 0 && ask.signum() > 0;
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return Duration.between(timestamp, now).compareTo(maxAge) > 0;
    }
}
