package in.spreadarb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Market data polling settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PollingSettings(
    @JsonProperty("intervalMs")
    long intervalMs,

    @JsonProperty("tickerTimeoutMs")
    long tickerTimeoutMs,           // per exchange call

    @JsonProperty("detectionWindowMs")
    long detectionWindowMs,         // both legs must be refreshed within this window

    @JsonProperty("maxTickerAgeMs")
    long maxTickerAgeMs,            // older quotes are treated as stale

    @JsonProperty("orderBookDepth")
    int orderBookDepth,

    @JsonProperty("failuresBeforeBackoff")
    int failuresBeforeBackoff,

    @JsonProperty("maxBackoffMs")
    long maxBackoffMs
) {
    public static PollingSettings defaults() {
        return new PollingSettings(1000, 3000, 2000, 5000, 10, 5, 30_000);
    }

    public boolean isValid() {
        return intervalMs > 0
            && tickerTimeoutMs > 0
            && detectionWindowMs > 0
            && maxTickerAgeMs > 0
            && orderBookDepth > 0
            && failuresBeforeBackoff > 0
            && maxBackoffMs >= intervalMs;
    }

    public PollingSettings withIntervalMs(long value) {
        return new PollingSettings(value, tickerTimeoutMs, detectionWindowMs, maxTickerAgeMs, orderBookDepth,
            failuresBeforeBackoff, Math.max(maxBackoffMs, value));
    }
}
