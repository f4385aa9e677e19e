package in.spreadarb.service.opportunity.rule;

import in.spreadarb.domain.market.Ticker;
import in.spreadarb.service.opportunity.EntryContext;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Both legs need at least the configured 24h volume.
 */
public final class VolumeRule implements EntryRule {
    private final BigDecimal minVolume;

    public VolumeRule(double minVolume24h) {
        this.minVolume = BigDecimal.valueOf(minVolume24h);
    }

    @Override
    public Optional<String> check(EntryContext context) {
        for (Ticker ticker : new Ticker[] {context.buyTicker(), context.sellTicker()}) {
            if (ticker.volume24h().compareTo(minVolume) < 0) {
                return Optional.of(String.format("24h volume on %s is %s, below %s",
                    ticker.exchange(), ticker.volume24h().toPlainString(), minVolume.toPlainString()));
            }
        }
        return Optional.empty();
    }
}
