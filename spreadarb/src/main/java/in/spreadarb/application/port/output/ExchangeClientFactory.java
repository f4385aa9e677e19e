package in.spreadarb.application.port.output;

import java.util.Set;

/**
 * Creates (or returns cached) exchange clients by exchange name.
 */
public interface ExchangeClientFactory {

    /**
     * @throws IllegalArgumentException if the exchange is not supported
     */
    ExchangeClient createClient(String exchangeName);

    Set<String> supportedExchanges();
}
