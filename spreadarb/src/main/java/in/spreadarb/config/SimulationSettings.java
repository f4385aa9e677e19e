package in.spreadarb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Seed data for a simulated exchange.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimulationSettings(
    @JsonProperty("balances")
    Map<String, BigDecimal> balances,

    @JsonProperty("midPrices")
    Map<String, BigDecimal> midPrices,      // BASE/QUOTE -> mid price

    @JsonProperty("spreadPercent")
    double spreadPercent,                   // bid/ask spread around the mid

    @JsonProperty("volatilityPercent")
    double volatilityPercent,               // random walk per ticker request

    @JsonProperty("volume24h")
    BigDecimal volume24h
) {
    public SimulationSettings {
        balances = balances == null ? Map.of() : Map.copyOf(balances);
        midPrices = midPrices == null ? Map.of() : Map.copyOf(midPrices);
        if (volume24h == null) volume24h = new BigDecimal("5000000");
    }
}
