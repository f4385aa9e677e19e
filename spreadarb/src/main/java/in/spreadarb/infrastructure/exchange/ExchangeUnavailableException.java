package in.spreadarb.infrastructure.exchange;

/**
 * Transient exchange failure: timeout, rate limit or lost connectivity.
 */
public class ExchangeUnavailableException extends ExchangeException {

    public ExchangeUnavailableException(String exchange, String message) {
        super(exchange, message);
    }

    public ExchangeUnavailableException(String exchange, String message, Throwable cause) {
        super(exchange, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
