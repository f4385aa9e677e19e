package in.spreadarb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Balance pool settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BalanceSettings(
    @JsonProperty("refreshIntervalMs")
    long refreshIntervalMs,

    @JsonProperty("valuationCurrency")
    String valuationCurrency,

    @JsonProperty("historySize")
    int historySize,

    @JsonProperty("rebalanceThresholdPercent")
    double rebalanceThresholdPercent    // share deviation from an even split that needs action
) {
    public static BalanceSettings defaults() {
        return new BalanceSettings(10_000, "USDT", 1000, 30.0);
    }

    public boolean isValid() {
        return refreshIntervalMs > 0
            && valuationCurrency != null && !valuationCurrency.isBlank()
            && historySize > 0
            && rebalanceThresholdPercent > 0 && rebalanceThresholdPercent < 50;
    }
}
