package in.spreadarb.domain.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Order execution settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdvancedRules(
    @JsonProperty("enableSlippageProtection")
    boolean enableSlippageProtection,

    @JsonProperty("maxSlippagePercent")
    double maxSlippagePercent,

    @JsonProperty("estimatedSlippagePercent")
    double estimatedSlippagePercent,    // subtracted from the gross spread

    @JsonProperty("useLimitOrders")
    boolean useLimitOrders,

    @JsonProperty("limitOrderOffsetPercent")
    double limitOrderOffsetPercent,

    @JsonProperty("orderTimeoutSeconds")
    int orderTimeoutSeconds,

    @JsonProperty("orderStatusPollMillis")
    int orderStatusPollMillis,

    @JsonProperty("retryFailedOrders")
    boolean retryFailedOrders,

    @JsonProperty("maxOrderRetries")
    int maxOrderRetries,

    @JsonProperty("splitLargeOrders")
    boolean splitLargeOrders,

    @JsonProperty("maxSingleOrderSize")
    double maxSingleOrderSize,          // quote currency per child order

    @JsonProperty("preferLowerFeeExchanges")
    boolean preferLowerFeeExchanges
) {
    public static AdvancedRules defaults() {
        return new AdvancedRules(true, 0.1, 0.05, false, 0.02, 10, 250, true, 2, true, 500, true);
    }

    public boolean isValid() {
        return maxSlippagePercent >= 0
            && estimatedSlippagePercent >= 0
            && limitOrderOffsetPercent >= 0
            && orderTimeoutSeconds > 0
            && orderStatusPollMillis > 0
            && maxOrderRetries >= 0
            && (!splitLargeOrders || maxSingleOrderSize > 0);
    }

    public AdvancedRules withOrderTiming(int timeoutSeconds, int pollMillis) {
        return new AdvancedRules(enableSlippageProtection, maxSlippagePercent, estimatedSlippagePercent,
            useLimitOrders, limitOrderOffsetPercent, timeoutSeconds, pollMillis, retryFailedOrders,
            maxOrderRetries, splitLargeOrders, maxSingleOrderSize, preferLowerFeeExchanges);
    }

    public AdvancedRules withSplitting(boolean split, double maxSingleOrderSize) {
        return new AdvancedRules(enableSlippageProtection, maxSlippagePercent, estimatedSlippagePercent,
            useLimitOrders, limitOrderOffsetPercent, orderTimeoutSeconds, orderStatusPollMillis, retryFailedOrders,
            maxOrderRetries, split, maxSingleOrderSize, preferLowerFeeExchanges);
    }

    public AdvancedRules withLimitOrders(boolean useLimit, double offsetPercent) {
        return new AdvancedRules(enableSlippageProtection, maxSlippagePercent, estimatedSlippagePercent,
            useLimit, offsetPercent, orderTimeoutSeconds, orderStatusPollMillis, retryFailedOrders,
            maxOrderRetries, splitLargeOrders, maxSingleOrderSize, preferLowerFeeExchanges);
    }

    public AdvancedRules withEstimatedSlippagePercent(double value) {
        return new AdvancedRules(enableSlippageProtection, maxSlippagePercent, value,
            useLimitOrders, limitOrderOffsetPercent, orderTimeoutSeconds, orderStatusPollMillis, retryFailedOrders,
            maxOrderRetries, splitLargeOrders, maxSingleOrderSize, preferLowerFeeExchanges);
    }

    public AdvancedRules withRetries(boolean retry, int maxRetries) {
        return new AdvancedRules(enableSlippageProtection, maxSlippagePercent, estimatedSlippagePercent,
            useLimitOrders, limitOrderOffsetPercent, orderTimeoutSeconds, orderStatusPollMillis, retry,
            maxRetries, splitLargeOrders, maxSingleOrderSize, preferLowerFeeExchanges);
    }
}
