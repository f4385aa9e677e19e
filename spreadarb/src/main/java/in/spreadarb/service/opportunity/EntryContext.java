package in.spreadarb.service.opportunity;

import in.spreadarb.domain.market.OrderBook;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.trade.ArbitrageDirection;
import in.spreadarb.service.market.PriceHistory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Everything an entry rule may look at for one candidate direction.
 * Order books and histories are null when not available.
 */
public record EntryContext(
    String symbol,
    ArbitrageDirection direction,
    Ticker buyTicker,
    Ticker sellTicker,
    BigDecimal netSpreadPercent,
    BigDecimal expectedNetProfit,       // quote currency at the suggested quantity
    OrderBook buyBook,
    OrderBook sellBook,
    PriceHistory buyHistory,
    PriceHistory sellHistory,
    int confirmations,
    Duration confirmedFor,
    Instant now
) {}
