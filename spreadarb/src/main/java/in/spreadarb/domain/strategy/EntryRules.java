package in.spreadarb.domain.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * When an opportunity may be entered.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntryRules(
    @JsonProperty("minSpreadPercent")
    double minSpreadPercent,            // net spread floor, inclusive

    @JsonProperty("maxSpreadPercent")
    double maxSpreadPercent,            // above this the quote is treated as bad data

    @JsonProperty("minExpectedProfit")
    double minExpectedProfit,           // quote currency, inclusive; 0 disables

    @JsonProperty("minVolume24h")
    double minVolume24h,                // quote currency, both legs

    @JsonProperty("spreadConfirmationSeconds")
    int spreadConfirmationSeconds,

    @JsonProperty("requiredConfirmations")
    int requiredConfirmations,

    @JsonProperty("checkMomentum")
    boolean checkMomentum,

    @JsonProperty("momentumPeriodMinutes")
    int momentumPeriodMinutes,

    @JsonProperty("avoidHighVolatility")
    boolean avoidHighVolatility,

    @JsonProperty("maxVolatilityPercent")
    double maxVolatilityPercent,

    @JsonProperty("checkOrderBookDepth")
    boolean checkOrderBookDepth,

    @JsonProperty("minOrderBookDepth")
    double minOrderBookDepth,           // quote currency on the side we take

    @JsonProperty("orderBookDepthLevels")
    int orderBookDepthLevels
) {
    public static EntryRules defaults() {
        return new EntryRules(0.15, 5.0, 0.5, 100_000, 3, 2, true, 5, true, 2.0, true, 10_000, 10);
    }

    public boolean isValid() {
        return minSpreadPercent >= 0
            && maxSpreadPercent > minSpreadPercent
            && minExpectedProfit >= 0
            && minVolume24h >= 0
            && spreadConfirmationSeconds >= 0
            && requiredConfirmations >= 1
            && (!checkMomentum || momentumPeriodMinutes > 0)
            && (!avoidHighVolatility || maxVolatilityPercent > 0)
            && (!checkOrderBookDepth || (minOrderBookDepth >= 0 && orderBookDepthLevels > 0));
    }

    public EntryRules withMinSpreadPercent(double value) {
        return new EntryRules(value, maxSpreadPercent, minExpectedProfit, minVolume24h, spreadConfirmationSeconds,
            requiredConfirmations, checkMomentum, momentumPeriodMinutes, avoidHighVolatility,
            maxVolatilityPercent, checkOrderBookDepth, minOrderBookDepth, orderBookDepthLevels);
    }

    public EntryRules withMinExpectedProfit(double value) {
        return new EntryRules(minSpreadPercent, maxSpreadPercent, value, minVolume24h, spreadConfirmationSeconds,
            requiredConfirmations, checkMomentum, momentumPeriodMinutes, avoidHighVolatility,
            maxVolatilityPercent, checkOrderBookDepth, minOrderBookDepth, orderBookDepthLevels);
    }

    public EntryRules withMinVolume24h(double value) {
        return new EntryRules(minSpreadPercent, maxSpreadPercent, minExpectedProfit, value, spreadConfirmationSeconds,
            requiredConfirmations, checkMomentum, momentumPeriodMinutes, avoidHighVolatility,
            maxVolatilityPercent, checkOrderBookDepth, minOrderBookDepth, orderBookDepthLevels);
    }

    public EntryRules withConfirmation(int confirmations, int seconds) {
        return new EntryRules(minSpreadPercent, maxSpreadPercent, minExpectedProfit, minVolume24h, seconds,
            confirmations, checkMomentum, momentumPeriodMinutes, avoidHighVolatility,
            maxVolatilityPercent, checkOrderBookDepth, minOrderBookDepth, orderBookDepthLevels);
    }

    /**
     * Spread and volume rules only; single-observation entry.
     */
    public EntryRules withoutMarketChecks() {
        return new EntryRules(minSpreadPercent, maxSpreadPercent, minExpectedProfit, minVolume24h, 0,
            1, false, momentumPeriodMinutes, false,
            maxVolatilityPercent, false, minOrderBookDepth, orderBookDepthLevels);
    }
}
