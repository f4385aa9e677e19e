package in.spreadarb.domain.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Exit thresholds applied to inventory stranded by a failed sell leg.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExitRules(
    @JsonProperty("takeProfitPercent")
    double takeProfitPercent,

    @JsonProperty("stopLossPercent")
    double stopLossPercent,

    @JsonProperty("enableTrailingStop")
    boolean enableTrailingStop,

    @JsonProperty("trailingStopActivationPercent")
    double trailingStopActivationPercent,   // profit before the trail arms

    @JsonProperty("trailingStopDistancePercent")
    double trailingStopDistancePercent,     // distance below the highest price

    @JsonProperty("maxHoldTimeMinutes")
    int maxHoldTimeMinutes
) {
    public static ExitRules defaults() {
        return new ExitRules(0.5, 0.3, false, 0.3, 0.1, 30);
    }

    public boolean isValid() {
        return takeProfitPercent > 0
            && stopLossPercent > 0
            && (!enableTrailingStop || (trailingStopActivationPercent > 0 && trailingStopDistancePercent > 0))
            && maxHoldTimeMinutes >= 0;
    }

    public ExitRules withTrailingStop(double activationPercent, double distancePercent) {
        return new ExitRules(takeProfitPercent, stopLossPercent, true, activationPercent, distancePercent, maxHoldTimeMinutes);
    }
}
