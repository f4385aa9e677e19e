package in.spreadarb.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Order book snapshot. Bids are sorted best (highest) first, asks best (lowest) first.
 */
public record OrderBook(
    String exchange,
    String symbol,
    List<OrderBookLevel> bids,
    List<OrderBookLevel> asks,
    Instant timestamp
) {
    public OrderBook {
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    /**
     * Quote-currency value resting on the first {@code levels} bid levels.
     */
    public BigDecimal bidDepthQuote(int levels) {
        return depth(bids, levels);
    }

    /**
     * Quote-currency value resting on the first {@code levels} ask levels.
     */
    public BigDecimal askDepthQuote(int levels) {
        return depth(asks, levels);
    }

    private static BigDecimal depth(List<OrderBookLevel> side, int levels) {
        return side.stream()
            .limit(Math.max(0, levels))
            .map(OrderBookLevel::notional)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
