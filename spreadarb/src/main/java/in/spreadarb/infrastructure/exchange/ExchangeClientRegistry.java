package in.spreadarb.infrastructure.exchange;

import in.spreadarb.application.port.output.ExchangeClient;
import in.spreadarb.application.port.output.ExchangeClientFactory;
import in.spreadarb.config.ExchangeSettings;
import in.spreadarb.config.SimulationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Exchange client factory with one cached client per exchange name.
 *
 * Live exchange clients are registered by the host application through
 * {@link #register(String, Supplier)}; simulated exchanges can be built from configuration.
 */
public final class ExchangeClientRegistry implements ExchangeClientFactory {
    private static final Logger log = LoggerFactory.getLogger(ExchangeClientRegistry.class);

    private final Map<String, Supplier<ExchangeClient>> suppliers = new ConcurrentHashMap<>();
    private final Map<String, ExchangeClient> clients = new ConcurrentHashMap<>();

    public ExchangeClientRegistry register(String exchangeName, Supplier<ExchangeClient> supplier) {
        suppliers.put(exchangeName, supplier);
        clients.remove(exchangeName);
        log.info("Registered exchange client: {}", exchangeName);
        return this;
    }

    /**
     * Register an already built client.
     */
    public ExchangeClientRegistry register(ExchangeClient client) {
        return register(client.name(), () -> client);
    }

    @Override
    public ExchangeClient createClient(String exchangeName) {
        Supplier<ExchangeClient> supplier = suppliers.get(exchangeName);
        if (supplier == null) {
            throw new IllegalArgumentException("Unsupported exchange: " + exchangeName);
        }
        return clients.computeIfAbsent(exchangeName, name -> supplier.get());
    }

    @Override
    public Set<String> supportedExchanges() {
        return new TreeSet<>(suppliers.keySet());
    }

    /**
     * Registry with a simulated client for every enabled SIMULATED exchange in {@code settings}.
     * Other kinds are skipped with a warning; their clients must be registered separately.
     */
    public static ExchangeClientRegistry fromSettings(List<ExchangeSettings> settings) {
        ExchangeClientRegistry registry = new ExchangeClientRegistry();
        for (ExchangeSettings exchange : settings) {
            if (!exchange.enabled()) {
                continue;
            }
            if (!ExchangeSettings.KIND_SIMULATED.equalsIgnoreCase(exchange.kind())) {
                log.warn("⚠️ No bundled client for exchange {} of kind {}", exchange.name(), exchange.kind());
                continue;
            }
            registry.register(exchange.name(), () -> simulated(exchange));
        }
        return registry;
    }

    static SimulatedExchangeClient simulated(ExchangeSettings exchange) {
        SimulatedExchangeClient client =
            new SimulatedExchangeClient(exchange.name(), BigDecimal.valueOf(exchange.takerFeePercent()));
        SimulationSettings simulation = exchange.simulation();
        if (simulation == null) {
            return client;
        }
        simulation.balances().forEach(client::withBalance);
        simulation.midPrices().forEach((symbol, mid) -> {
            String[] parts = symbol.split("/");
            if (parts.length != 2) {
                log.warn("⚠️ Ignoring simulated market {} on {}: expected BASE/QUOTE", symbol, exchange.name());
                return;
            }
            client.withMarket(parts[0], parts[1], mid, simulation.spreadPercent(), simulation.volume24h());
        });
        client.setVolatilityPercent(simulation.volatilityPercent());
        return client;
    }
}
