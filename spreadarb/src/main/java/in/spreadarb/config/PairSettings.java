package in.spreadarb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.spreadarb.domain.pair.TradingPair;

import java.math.BigDecimal;

/**
 * One configured trading pair.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PairSettings(
    @JsonProperty("symbol")
    String symbol,                  // BASE/QUOTE

    @JsonProperty("exchangeA")
    String exchangeA,

    @JsonProperty("exchangeB")
    String exchangeB,

    @JsonProperty("tradeAmountQuote")
    BigDecimal tradeAmountQuote,

    @JsonProperty("quantityScale")
    Integer quantityScale,

    @JsonProperty("enabled")
    Boolean enabled
) {
    public TradingPair toTradingPair() {
        TradingPair pair = TradingPair.fromSymbol(symbol, exchangeA, exchangeB, tradeAmountQuote);
        if (quantityScale != null) {
            pair = new TradingPair(pair.symbol(), pair.baseCurrency(), pair.quoteCurrency(),
                pair.legA(), pair.legB(), pair.enabled(), pair.tradeAmountQuote(), quantityScale);
        }
        return enabled == null ? pair : pair.withEnabled(enabled);
    }
}
