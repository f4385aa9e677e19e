package in.spreadarb.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.spreadarb.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the engine configuration.
 *
 * Order of precedence:
 * 1. Environment overrides (SPREADARB_TRADING_ENABLED, SPREADARB_METRICS_PORT, SPREADARB_POLL_INTERVAL_MS)
 * 2. spreadarb-config.json in the config directory
 * 3. {@link EngineConfig#defaults()}
 *
 * A missing or unreadable file falls back to defaults; it never prevents startup by itself.
 */
public final class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "spreadarb-config.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path configFilePath;

    public EngineConfigLoader(String configDir) {
        this.configFilePath = Paths.get(configDir, CONFIG_FILE_NAME);
    }

    /**
     * Loader for the directory named by SPREADARB_CONFIG_DIR (default "config").
     */
    public static EngineConfigLoader fromEnvironment() {
        return new EngineConfigLoader(Env.get("SPREADARB_CONFIG_DIR", "config"));
    }

    public EngineConfig load() {
        return applyEnvironmentOverrides(readFile());
    }

    private EngineConfig readFile() {
        try {
            if (Files.exists(configFilePath)) {
                EngineConfig config = MAPPER.readValue(Files.readString(configFilePath), EngineConfig.class);
                log.info("✅ Loaded engine config from: {}", configFilePath);
                return config;
            }
            log.info("No config file found, using defaults: {}", configFilePath);
            return EngineConfig.defaults();
        } catch (IOException e) {
            log.error("Failed to load config file {}, using defaults: {}", configFilePath, e.getMessage());
            return EngineConfig.defaults();
        }
    }

    static EngineConfig applyEnvironmentOverrides(EngineConfig config) {
        EngineSettings engine = config.engine();
        boolean tradingEnabled = Env.getBool("SPREADARB_TRADING_ENABLED", engine.tradingEnabled());
        int metricsPort = Env.getInt("SPREADARB_METRICS_PORT", engine.metricsPort());
        long pollInterval = Env.getLong("SPREADARB_POLL_INTERVAL_MS", config.polling().intervalMs());

        EngineConfig result = config
            .withEngine(engine.withTradingEnabled(tradingEnabled).withMetricsPort(metricsPort));
        if (pollInterval != config.polling().intervalMs()) {
            result = result.withPolling(config.polling().withIntervalMs(pollInterval));
        }
        if (tradingEnabled != engine.tradingEnabled()) {
            log.info("Trading enabled overridden from environment: {}", tradingEnabled);
        }
        return result;
    }
}
