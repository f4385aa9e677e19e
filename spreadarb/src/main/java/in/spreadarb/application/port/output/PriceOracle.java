package in.spreadarb.application.port.output;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Prices used to value balances in a common quote currency.
 */
public interface PriceOracle {

    /**
     * Price of one unit of {@code asset} expressed in {@code quoteCurrency}.
     * Empty when no recent market data is available.
     */
    Optional<BigDecimal> priceIn(String asset, String quoteCurrency);
}
