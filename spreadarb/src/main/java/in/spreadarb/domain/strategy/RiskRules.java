package in.spreadarb.domain.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Position sizing and loss limits.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskRules(
    @JsonProperty("maxPositionSize")
    double maxPositionSize,             // quote currency per trade

    @JsonProperty("maxBalancePercentPerTrade")
    double maxBalancePercentPerTrade,

    @JsonProperty("maxDailyLoss")
    double maxDailyLoss,                // quote currency

    @JsonProperty("maxConsecutiveLosses")
    int maxConsecutiveLosses,

    @JsonProperty("pauseAfterLossesMinutes")
    int pauseAfterLossesMinutes,        // 0 = stay paused until resumed by hand

    @JsonProperty("maxOpenPositions")
    int maxOpenPositions,

    @JsonProperty("maxTradesPerHour")
    int maxTradesPerHour,

    @JsonProperty("minTimeBetweenTradesSeconds")
    int minTimeBetweenTradesSeconds,

    @JsonProperty("enableDrawdownProtection")
    boolean enableDrawdownProtection,

    @JsonProperty("maxDrawdownPercent")
    double maxDrawdownPercent
) {
    public static RiskRules defaults() {
        return new RiskRules(1000, 10, 100, 3, 30, 3, 10, 30, true, 5.0);
    }

    public boolean isValid() {
        return maxPositionSize > 0
            && maxBalancePercentPerTrade > 0 && maxBalancePercentPerTrade <= 100
            && maxDailyLoss > 0
            && maxConsecutiveLosses > 0
            && pauseAfterLossesMinutes >= 0
            && maxOpenPositions > 0
            && maxTradesPerHour > 0
            && minTimeBetweenTradesSeconds >= 0
            && maxDrawdownPercent > 0 && maxDrawdownPercent <= 100;
    }

    public RiskRules withMaxConsecutiveLosses(int value) {
        return new RiskRules(maxPositionSize, maxBalancePercentPerTrade, maxDailyLoss, value,
            pauseAfterLossesMinutes, maxOpenPositions, maxTradesPerHour, minTimeBetweenTradesSeconds,
            enableDrawdownProtection, maxDrawdownPercent);
    }

    public RiskRules withMaxDrawdownPercent(double value) {
        return new RiskRules(maxPositionSize, maxBalancePercentPerTrade, maxDailyLoss, maxConsecutiveLosses,
            pauseAfterLossesMinutes, maxOpenPositions, maxTradesPerHour, minTimeBetweenTradesSeconds,
            enableDrawdownProtection, value);
    }

    public RiskRules withMaxDailyLoss(double value) {
        return new RiskRules(maxPositionSize, maxBalancePercentPerTrade, value, maxConsecutiveLosses,
            pauseAfterLossesMinutes, maxOpenPositions, maxTradesPerHour, minTimeBetweenTradesSeconds,
            enableDrawdownProtection, maxDrawdownPercent);
    }

    /**
     * Same limits without the trade-frequency throttles.
     */
    public RiskRules withoutThrottling() {
        return new RiskRules(maxPositionSize, maxBalancePercentPerTrade, maxDailyLoss, maxConsecutiveLosses,
            pauseAfterLossesMinutes, Integer.MAX_VALUE, Integer.MAX_VALUE, 0,
            enableDrawdownProtection, maxDrawdownPercent);
    }

    public RiskRules withPosition(double maxPositionSize, double maxBalancePercentPerTrade) {
        return new RiskRules(maxPositionSize, maxBalancePercentPerTrade, maxDailyLoss, maxConsecutiveLosses,
            pauseAfterLossesMinutes, maxOpenPositions, maxTradesPerHour, minTimeBetweenTradesSeconds,
            enableDrawdownProtection, maxDrawdownPercent);
    }
}
