package in.spreadarb.service.opportunity.rule;

import in.spreadarb.service.opportunity.EntryContext;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Quote-currency liquidity on the side we take: asks on the buy exchange, bids on the
 * sell exchange. Falls back to top-of-book size when no book was fetched.
 */
public final class OrderBookDepthRule implements EntryRule {
    private final BigDecimal minDepth;
    private final int levels;

    public OrderBookDepthRule(double minDepthQuote, int levels) {
        this.minDepth = BigDecimal.valueOf(minDepthQuote);
        this.levels = levels;
    }

    @Override
    public Optional<String> check(EntryContext context) {
        BigDecimal askDepth = context.buyBook() != null
            ? context.buyBook().askDepthQuote(levels)
            : context.buyTicker().ask().multiply(context.buyTicker().askQuantity());
        if (askDepth.compareTo(minDepth) < 0) {
            return Optional.of(String.format("Ask depth on %s is %.2f, below %s",
                context.buyTicker().exchange(), askDepth, minDepth.toPlainString()));
        }
        BigDecimal bidDepth = context.sellBook() != null
            ? context.sellBook().bidDepthQuote(levels)
            : context.sellTicker().bid().multiply(context.sellTicker().bidQuantity());
        if (bidDepth.compareTo(minDepth) < 0) {
            return Optional.of(String.format("Bid depth on %s is %.2f, below %s",
                context.sellTicker().exchange(), bidDepth, minDepth.toPlainString()));
        }
        return Optional.empty();
    }
}
