package in.spreadarb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Emergency guard thresholds that are not part of a trading strategy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmergencySettings(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("rapidLossWindowSeconds")
    long rapidLossWindowSeconds,

    @JsonProperty("rapidLossMinTrades")
    int rapidLossMinTrades,

    @JsonProperty("rapidLossThresholdPercent")
    double rapidLossThresholdPercent,   // of starting equity

    @JsonProperty("criticalImbalancePercent")
    double criticalImbalancePercent     // share deviation from an even split
) {
    public static EmergencySettings defaults() {
        return new EmergencySettings(true, 300, 3, 1.0, 40.0);
    }

    public boolean isValid() {
        return rapidLossWindowSeconds > 0
            && rapidLossMinTrades > 0
            && rapidLossThresholdPercent > 0
            && criticalImbalancePercent > 0 && criticalImbalancePercent <= 50;
    }
}
