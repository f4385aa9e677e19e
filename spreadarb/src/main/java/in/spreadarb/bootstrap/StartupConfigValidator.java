package in.spreadarb.bootstrap;

import in.spreadarb.application.port.output.ExchangeClientFactory;
import in.spreadarb.config.EngineConfig;
import in.spreadarb.config.ExchangeSettings;
import in.spreadarb.config.PairSettings;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before the engine is built. Invalid configuration throws IllegalStateException
 * and the process refuses to start.
 *
 * Production mode (SPREADARB_PRODUCTION_MODE=true) is a hard gate:
 * - trading must be enabled
 * - no pair may trade on a SIMULATED exchange
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static void validate(EngineConfig config, ExchangeClientFactory clients, TradingStrategy strategy) {
        validate(config, clients, strategy, Env.getBool("SPREADARB_PRODUCTION_MODE", false));
    }

    static void validate(EngineConfig config, ExchangeClientFactory clients, TradingStrategy strategy,
                         boolean productionMode) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", productionMode);

        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: " + String.join("; ", errors) + "\n" +
                "System refuses to start.");
        }
        log.info("✓ Configuration sections valid");

        if (strategy == null || !strategy.isValid()) {
            throw new IllegalStateException(
                "❌ INVALID STRATEGY: '" + config.engine().strategyId() + "' is missing or invalid\n" +
                "System refuses to start.");
        }
        log.info("✓ Strategy {} valid", strategy.id());

        Set<String> available = clients.supportedExchanges();
        for (PairSettings pair : config.pairs()) {
            if (!available.contains(pair.exchangeA()) || !available.contains(pair.exchangeB())) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: pair " + pair.symbol() + " needs " + pair.exchangeA() + " and "
                        + pair.exchangeB() + " but only " + available + " have clients\n" +
                    "Register a client for every exchange a pair trades on.");
            }
        }
        log.info("✓ {} pair(s) have clients on both legs", config.pairs().size());

        if (productionMode) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateProductionMode(EngineConfig config) {
        if (!config.engine().tradingEnabled()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires tradingEnabled=true\n" +
                "Either:\n" +
                "  1. Enable trading: set SPREADARB_TRADING_ENABLED=true\n" +
                "  2. Set SPREADARB_PRODUCTION_MODE=false for detect-only runs");
        }
        for (PairSettings pair : config.pairs()) {
            for (String exchange : List.of(pair.exchangeA(), pair.exchangeB())) {
                if (isSimulated(config, exchange)) {
                    throw new IllegalStateException(
                        "❌ INVALID CONFIG: PRODUCTION MODE forbids simulated exchanges\n" +
                        "Pair " + pair.symbol() + " trades on " + exchange);
                }
            }
        }
        log.info("✅ PRODUCTION MODE validation passed");
    }

    private static void warnNonProductionMode(EngineConfig config) {
        log.warn("⚠️  NON-PRODUCTION MODE detected");
        if (!config.engine().tradingEnabled()) {
            log.warn("⚠️  Trading DISABLED - opportunities are detected and reported only");
        }
        for (ExchangeSettings exchange : config.exchanges()) {
            if (exchange.enabled() && ExchangeSettings.KIND_SIMULATED.equalsIgnoreCase(exchange.kind())) {
                log.warn("⚠️  Simulated exchange: {}", exchange.name());
            }
        }
    }

    private static boolean isSimulated(EngineConfig config, String exchangeName) {
        for (ExchangeSettings exchange : config.exchanges()) {
            if (exchange.name().equals(exchangeName)) {
                return ExchangeSettings.KIND_SIMULATED.equalsIgnoreCase(exchange.kind());
            }
        }
        return false;
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
