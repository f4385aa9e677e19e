package in.spreadarb.service.market;

import in.spreadarb.domain.market.OrderBook;
import in.spreadarb.domain.market.Ticker;

/**
 * Both legs of one polling cycle. Order books are null unless depth checks are enabled.
 */
public record TickerPair(Ticker tickerA, Ticker tickerB, OrderBook bookA, OrderBook bookB) {
    public TickerPair {
        if (tickerA == null || tickerB == null) {
            throw new IllegalArgumentException("both tickers are required");
        }
    }
}
