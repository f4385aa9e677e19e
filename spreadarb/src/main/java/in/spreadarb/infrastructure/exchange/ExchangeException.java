package in.spreadarb.infrastructure.exchange;

/**
 * Base class for failures reported by an exchange client.
 */
public class ExchangeException extends RuntimeException {

    private final String exchange;

    public ExchangeException(String exchange, String message) {
        super(String.format("[%s] %s", exchange, message));
        this.exchange = exchange;
    }

    public ExchangeException(String exchange, String message, Throwable cause) {
        super(String.format("[%s] %s", exchange, message), cause);
        this.exchange = exchange;
    }

    public String getExchange() {
        return exchange;
    }

    /**
     * Whether repeating the same call later may succeed.
     */
    public boolean isTransient() {
        return false;
    }
}
