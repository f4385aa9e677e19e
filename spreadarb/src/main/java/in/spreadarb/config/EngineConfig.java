package in.spreadarb.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration of the arbitrage engine.
 * Loaded from spreadarb-config.json by {@link EngineConfigLoader}; missing sections fall back to defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("engine")
    EngineSettings engine,

    @JsonProperty("polling")
    PollingSettings polling,

    @JsonProperty("balance")
    BalanceSettings balance,

    @JsonProperty("emergency")
    EmergencySettings emergency,

    @JsonProperty("exchanges")
    List<ExchangeSettings> exchanges,

    @JsonProperty("pairs")
    List<PairSettings> pairs
) {
    public EngineConfig {
        if (engine == null) engine = EngineSettings.defaults();
        if (polling == null) polling = PollingSettings.defaults();
        if (balance == null) balance = BalanceSettings.defaults();
        if (emergency == null) emergency = EmergencySettings.defaults();
        exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
    }

    /**
     * Two simulated exchanges quoting BTC/USDT, trading disabled.
     */
    public static EngineConfig defaults() {
        Map<String, BigDecimal> balances = Map.of("USDT", new BigDecimal("10000"), "BTC", new BigDecimal("0.2"));
        return new EngineConfig(
            EngineSettings.defaults(),
            PollingSettings.defaults(),
            BalanceSettings.defaults(),
            EmergencySettings.defaults(),
            List.of(
                ExchangeSettings.simulated("SIM_A", balances, Map.of("BTC/USDT", new BigDecimal("50000"))),
                ExchangeSettings.simulated("SIM_B", balances, Map.of("BTC/USDT", new BigDecimal("50100")))),
            List.of(new PairSettings("BTC/USDT", "SIM_A", "SIM_B", new BigDecimal("500"), 6, true)));
    }

    /**
     * Human-readable problems; empty when the configuration is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!engine.isValid()) errors.add("engine settings are invalid");
        if (!polling.isValid()) errors.add("polling settings are invalid");
        if (!balance.isValid()) errors.add("balance settings are invalid");
        if (!emergency.isValid()) errors.add("emergency settings are invalid");

        Set<String> names = new HashSet<>();
        for (ExchangeSettings exchange : exchanges) {
            if (!exchange.isValid()) {
                errors.add("exchange '" + exchange.name() + "' is invalid");
            } else if (!names.add(exchange.name())) {
                errors.add("exchange '" + exchange.name() + "' is configured twice");
            }
        }
        for (PairSettings pair : pairs) {
            try {
                pair.toTradingPair();
            } catch (IllegalArgumentException e) {
                errors.add("pair '" + pair.symbol() + "': " + e.getMessage());
                continue;
            }
            if (!names.contains(pair.exchangeA()) || !names.contains(pair.exchangeB())) {
                errors.add("pair '" + pair.symbol() + "' references an unconfigured exchange");
            }
        }
        return errors;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    public EngineConfig withEngine(EngineSettings settings) {
        return new EngineConfig(settings, polling, balance, emergency, exchanges, pairs);
    }

    public EngineConfig withPolling(PollingSettings settings) {
        return new EngineConfig(engine, settings, balance, emergency, exchanges, pairs);
    }

    public EngineConfig withEmergency(EmergencySettings settings) {
        return new EngineConfig(engine, polling, balance, settings, exchanges, pairs);
    }
}
