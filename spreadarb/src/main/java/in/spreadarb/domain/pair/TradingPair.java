package in.spreadarb.domain.pair;

import java.math.BigDecimal;

/**
 * One arbitrage route: the same asset pair quoted on two distinct exchanges.
 *
 * Identity fields (symbol, currencies, legs) never change. Enabling or disabling
 * a pair produces a copy that the engine's pair registry swaps in.
 */
public record TradingPair(
    String symbol,              // e.g. BTC/USDT
    String baseCurrency,
    String quoteCurrency,
    PairLeg legA,
    PairLeg legB,
    boolean enabled,
    BigDecimal tradeAmountQuote,
    int quantityScale
) {
    public static final int DEFAULT_QUANTITY_SCALE = 6;

    public TradingPair {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be blank");
        }
        if (baseCurrency == null || quoteCurrency == null) {
            throw new IllegalArgumentException("base and quote currency are required");
        }
        if (legA == null || legB == null) {
            throw new IllegalArgumentException("Trading pair " + symbol + " needs two exchange legs");
        }
        if (legA.exchange().equalsIgnoreCase(legB.exchange())) {
            throw new IllegalArgumentException(
                "Trading pair " + symbol + " legs must be on distinct exchanges, got " + legA.exchange() + " twice");
        }
        if (tradeAmountQuote == null || tradeAmountQuote.signum() <= 0) {
            throw new IllegalArgumentException("tradeAmountQuote must be positive");
        }
        if (quantityScale < 0) {
            throw new IllegalArgumentException("quantityScale cannot be negative");
        }
    }

    /**
     * Build a pair from a "BASE/QUOTE" symbol, deriving exchange symbols as BASEQUOTE.
     */
    public static TradingPair fromSymbol(String symbol, String exchangeA, String exchangeB, BigDecimal tradeAmountQuote) {
        if (symbol == null || !symbol.contains("/")) {
            throw new IllegalArgumentException("Symbol must look like BASE/QUOTE: " + symbol);
        }
        String[] parts = symbol.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Symbol must look like BASE/QUOTE: " + symbol);
        }
        String base = parts[0].trim().toUpperCase();
        String quote = parts[1].trim().toUpperCase();
        String exchangeSymbol = base + quote;
        return new TradingPair(
            base + "/" + quote, base, quote,
            new PairLeg(exchangeA, exchangeSymbol),
            new PairLeg(exchangeB, exchangeSymbol),
            true, tradeAmountQuote, DEFAULT_QUANTITY_SCALE);
    }

    public TradingPair withEnabled(boolean enabled) {
        return new TradingPair(symbol, baseCurrency, quoteCurrency, legA, legB, enabled, tradeAmountQuote, quantityScale);
    }

    public PairLeg leg(String exchange) {
        if (legA.exchange().equalsIgnoreCase(exchange)) return legA;
        if (legB.exchange().equalsIgnoreCase(exchange)) return legB;
        throw new IllegalArgumentException("Exchange " + exchange + " is not a leg of " + symbol);
    }
}
