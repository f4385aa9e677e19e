package in.spreadarb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One configured exchange.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExchangeSettings(
    @JsonProperty("name")
    String name,

    @JsonProperty("kind")
    String kind,                    // SIMULATED; live clients are registered by the host application

    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("takerFeePercent")
    double takerFeePercent,

    @JsonProperty("timeoutMs")
    long timeoutMs,

    @JsonProperty("simulation")
    SimulationSettings simulation
) {
    public static final String KIND_SIMULATED = "SIMULATED";

    public static ExchangeSettings simulated(String name, Map<String, BigDecimal> balances, Map<String, BigDecimal> midPrices) {
        return new ExchangeSettings(name, KIND_SIMULATED, true, 0.1, 10_000,
            new SimulationSettings(balances, midPrices, 0.05, 0.0, new BigDecimal("5000000")));
    }

    public boolean isValid() {
        return name != null && !name.isBlank()
            && kind != null && !kind.isBlank()
            && takerFeePercent >= 0 && takerFeePercent < 10
            && timeoutMs > 0;
    }
}
