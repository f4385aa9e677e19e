package in.spreadarb.service.opportunity;

import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.pair.TradingPair;
import in.spreadarb.domain.strategy.RiskRules;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Suggested base quantity for one arbitrage attempt.
 *
 * Takes the minimum of:
 * 1. The pair's configured trade amount
 * 2. The strategy's maximum position size
 * 3. maxBalancePercentPerTrade of the quote available on the buy exchange
 * 4. Base available on the sell exchange
 * 5. Top-of-book size on both legs (when the exchange reports it)
 *
 * Balance limits apply only once a balance snapshot exists.
 * The result is rounded down to the pair's quantity scale.
 */
public final class PositionSizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public record Sizing(BigDecimal quantity, String limitedBy) {
        public boolean isZero() {
            return quantity.signum() <= 0;
        }
    }

    public static Sizing size(TradingPair pair, Ticker buyTicker, Ticker sellTicker,
                              RiskRules risk, CombinedBalanceSnapshot balances) {
        BigDecimal buyPrice = buyTicker.ask();
        if (buyPrice.signum() <= 0) {
            return new Sizing(BigDecimal.ZERO, "price");
        }

        BigDecimal budget = pair.tradeAmountQuote();
        String limitedBy = "tradeAmount";
        BigDecimal maxPosition = BigDecimal.valueOf(risk.maxPositionSize());
        if (maxPosition.compareTo(budget) < 0) {
            budget = maxPosition;
            limitedBy = "maxPositionSize";
        }
        if (balances != null && !balances.isEmpty()) {
            BigDecimal quoteAvailable = balances.available(buyTicker.exchange(), pair.quoteCurrency());
            BigDecimal balanceCap = quoteAvailable
                .multiply(BigDecimal.valueOf(risk.maxBalancePercentPerTrade()))
                .divide(HUNDRED, 8, RoundingMode.DOWN);
            if (balanceCap.compareTo(budget) < 0) {
                budget = balanceCap;
                limitedBy = "quoteBalance";
            }
        }

        BigDecimal quantity = budget.divide(buyPrice, pair.quantityScale(), RoundingMode.DOWN);

        if (balances != null && !balances.isEmpty()) {
            BigDecimal baseAvailable = balances.available(sellTicker.exchange(), pair.baseCurrency());
            if (baseAvailable.compareTo(quantity) < 0) {
                quantity = baseAvailable;
                limitedBy = "baseBalance";
            }
        }
        if (buyTicker.askQuantity().signum() > 0 && buyTicker.askQuantity().compareTo(quantity) < 0) {
            quantity = buyTicker.askQuantity();
            limitedBy = "askSize";
        }
        if (sellTicker.bidQuantity().signum() > 0 && sellTicker.bidQuantity().compareTo(quantity) < 0) {
            quantity = sellTicker.bidQuantity();
            limitedBy = "bidSize";
        }

        quantity = quantity.setScale(pair.quantityScale(), RoundingMode.DOWN);
        return new Sizing(quantity.max(BigDecimal.ZERO), limitedBy);
    }

    private PositionSizer() {}
}
