package in.spreadarb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Engine-wide runtime settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineSettings(
    @JsonProperty("tradingEnabled")
    boolean tradingEnabled,         // false = detect and report only

    @JsonProperty("executionThreads")
    int executionThreads,

    @JsonProperty("shutdownGraceMs")
    long shutdownGraceMs,

    @JsonProperty("strategyId")
    String strategyId,

    @JsonProperty("strategyDir")
    String strategyDir,

    @JsonProperty("metricsEnabled")
    boolean metricsEnabled,

    @JsonProperty("metricsPort")
    int metricsPort
) {
    public static EngineSettings defaults() {
        return new EngineSettings(false, 4, 15_000, "default", "config/strategies", true, 9091);
    }

    public boolean isValid() {
        return executionThreads > 0
            && shutdownGraceMs >= 0
            && strategyId != null && !strategyId.isBlank()
            && (!metricsEnabled || (metricsPort > 0 && metricsPort < 65536));
    }

    public EngineSettings withTradingEnabled(boolean enabled) {
        return new EngineSettings(enabled, executionThreads, shutdownGraceMs, strategyId, strategyDir, metricsEnabled, metricsPort);
    }

    public EngineSettings withShutdownGraceMs(long graceMs) {
        return new EngineSettings(tradingEnabled, executionThreads, graceMs, strategyId, strategyDir, metricsEnabled, metricsPort);
    }

    public EngineSettings withMetricsPort(int port) {
        return new EngineSettings(tradingEnabled, executionThreads, shutdownGraceMs, strategyId, strategyDir, metricsEnabled, port);
    }
}
