package in.spreadarb.domain.pair;

/**
 * One exchange side of a trading pair, with the symbol that exchange uses.
 */
public record PairLeg(String exchange, String exchangeSymbol) {
    public PairLeg {
        if (exchange == null || exchange.isBlank()) {
            throw new IllegalArgumentException("exchange cannot be blank");
        }
        if (exchangeSymbol == null || exchangeSymbol.isBlank()) {
            throw new IllegalArgumentException("exchangeSymbol cannot be blank");
        }
    }
}
