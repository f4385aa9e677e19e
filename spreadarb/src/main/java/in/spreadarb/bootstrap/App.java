package in.spreadarb.bootstrap;

import in.spreadarb.application.monitoring.AlertService;
import in.spreadarb.config.EngineConfig;
import in.spreadarb.config.EngineConfigLoader;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.infrastructure.exchange.ExchangeClientRegistry;
import in.spreadarb.infrastructure.history.InMemoryTradeHistory;
import in.spreadarb.infrastructure.metrics.MetricsEventListener;
import in.spreadarb.infrastructure.metrics.MetricsServer;
import in.spreadarb.infrastructure.metrics.PrometheusArbitrageMetrics;
import in.spreadarb.infrastructure.strategy.FileStrategyStore;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.service.core.JsonEventLogListener;
import in.spreadarb.service.engine.EngineController;
import in.spreadarb.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Core Java entry point (no framework).
 *
 * Wires the arbitrage engine from spreadarb-config.json:
 * - exchange clients (bundled SIMULATED kind only)
 * - strategy from the strategy directory
 * - event bus with log, alert and metrics listeners
 * - Prometheus /metrics on Undertow
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== SpreadArb Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        EngineConfig config = EngineConfigLoader.fromEnvironment().load();
        ExchangeClientRegistry clients = ExchangeClientRegistry.fromSettings(config.exchanges());

        FileStrategyStore strategies = new FileStrategyStore(Paths.get(config.engine().strategyDir()));
        TradingStrategy strategy = strategies.find(config.engine().strategyId()).orElseGet(() -> {
            log.warn("⚠️ Strategy '{}' not found in {}, using built-in defaults",
                config.engine().strategyId(), config.engine().strategyDir());
            return TradingStrategy.defaults();
        });

        StartupConfigValidator.validate(config, clients, strategy);

        // ═══════════════════════════════════════════════════════════════
        // Events and metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusArbitrageMetrics metrics = new PrometheusArbitrageMetrics();
        EngineEventBus events = new EngineEventBus();
        events.addListener(new JsonEventLogListener());
        events.addListener(new AlertService());
        events.addListener(new MetricsEventListener(metrics));

        MetricsServer metricsServer = null;
        if (config.engine().metricsEnabled()) {
            metricsServer = new MetricsServer(Env.get("SPREADARB_METRICS_HOST", "0.0.0.0"),
                config.engine().metricsPort(), metrics.getRegistry());
            metricsServer.start();
        }

        // ═══════════════════════════════════════════════════════════════
        // Engine
        // ═══════════════════════════════════════════════════════════════
        EngineController engine = new EngineController(config, clients, strategy,
            new InMemoryTradeHistory(), events, metrics, Clock.systemUTC());

        CountDownLatch shutdown = new CountDownLatch(1);
        MetricsServer server = metricsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping engine...");
            engine.close();
            if (server != null) {
                server.close();
            }
            events.close();
            shutdown.countDown();
        }, "shutdown-hook"));

        EngineStatus status = engine.start().join();
        if (status != EngineStatus.RUNNING) {
            log.error("❌ Engine failed to start: {}", engine.lastError()
                .map(e -> e.message()).orElse(String.valueOf(status)));
            System.exit(1);
        }
        log.info("✅ SpreadArb engine running with {} pair(s), strategy {}",
            engine.getTradingPairs().size(), strategy.id());

        shutdown.await();
    }

    private App() {}
}
