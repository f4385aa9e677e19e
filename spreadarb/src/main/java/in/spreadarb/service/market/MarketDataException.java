package in.spreadarb.service.market;

/**
 * A polling cycle could not produce both legs.
 */
public class MarketDataException extends RuntimeException {
    private final String pairSymbol;

    public MarketDataException(String pairSymbol, String message, Throwable cause) {
        super(pairSymbol + ": " + message, cause);
        this.pairSymbol = pairSymbol;
    }

    public String getPairSymbol() {
        return pairSymbol;
    }
}
