package in.spreadarb.infrastructure.metrics;

import in.spreadarb.domain.common.ErrorSeverity;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.trade.TradeResult;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Prometheus implementation of {@link ArbitrageMetrics}.
 *
 * Key Metrics:
 * - arb_opportunities_total{symbol, tradeable} - Detection results
 * - arb_trades_total{symbol, status} - Completed attempts by outcome
 * - arb_trade_duration_seconds{symbol} - Submit-to-completion time
 * - arb_trade_net_pnl_total{symbol} - Cumulative realized P&L (quote currency)
 * - arb_execution_skipped_total{symbol, reason} - Opportunities not executed
 * - arb_market_data_errors_total{exchange} - Failed ticker/order book calls
 * - arb_errors_total{severity} - Engine error events
 * - arb_emergency_triggers_total{reason} - Fired emergency rules
 * - arb_engine_status - Ordinal of the current EngineStatus
 * - arb_pool_equity / arb_pool_drawdown_percent - Balance pool state
 * - arb_executions_in_flight - Executions currently running
 *
 * Usage:
 * <pre>
 * PrometheusArbitrageMetrics metrics = new PrometheusArbitrageMetrics();
 * server.addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusArbitrageMetrics implements ArbitrageMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusArbitrageMetrics.class);

    private final CollectorRegistry registry;

    private final Counter opportunities;
    private final Counter trades;
    private final Histogram tradeDuration;
    private final Gauge netPnl;
    private final Counter executionSkipped;
    private final Counter marketDataErrors;
    private final Counter errors;
    private final Counter emergencies;
    private final Gauge engineStatus;
    private final Gauge poolEquity;
    private final Gauge poolDrawdown;
    private final Gauge inFlight;

    public PrometheusArbitrageMetrics() {
        this(new CollectorRegistry());
    }

    public PrometheusArbitrageMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.opportunities = Counter.build()
            .name("arb_opportunities_total")
            .help("Spread opportunities evaluated")
            .labelNames("symbol", "tradeable")
            .register(registry);

        this.trades = Counter.build()
            .name("arb_trades_total")
            .help("Arbitrage attempts by final status")
            .labelNames("symbol", "status")
            .register(registry);

        this.tradeDuration = Histogram.build()
            .name("arb_trade_duration_seconds")
            .help("Arbitrage attempt duration in seconds")
            .labelNames("symbol")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0)
            .register(registry);

        this.netPnl = Gauge.build()
            .name("arb_trade_net_pnl_total")
            .help("Cumulative net P&L of completed attempts in quote currency")
            .labelNames("symbol")
            .register(registry);

        this.executionSkipped = Counter.build()
            .name("arb_execution_skipped_total")
            .help("Opportunities that were not executed")
            .labelNames("symbol", "reason")
            .register(registry);

        this.marketDataErrors = Counter.build()
            .name("arb_market_data_errors_total")
            .help("Failed market data requests")
            .labelNames("exchange")
            .register(registry);

        this.errors = Counter.build()
            .name("arb_errors_total")
            .help("Engine error events")
            .labelNames("severity")
            .register(registry);

        this.emergencies = Counter.build()
            .name("arb_emergency_triggers_total")
            .help("Emergency rules fired")
            .labelNames("reason")
            .register(registry);

        this.engineStatus = Gauge.build()
            .name("arb_engine_status")
            .help("Engine status ordinal (0=IDLE,1=STARTING,2=RUNNING,3=PAUSED,4=STOPPING,5=STOPPED,6=ERROR)")
            .register(registry);

        this.poolEquity = Gauge.build()
            .name("arb_pool_equity")
            .help("Balance pool equity in valuation currency")
            .register(registry);

        this.poolDrawdown = Gauge.build()
            .name("arb_pool_drawdown_percent")
            .help("Current drawdown from peak equity in percent")
            .register(registry);

        this.inFlight = Gauge.build()
            .name("arb_executions_in_flight")
            .help("Arbitrage executions currently running")
            .register(registry);

        log.info("[PrometheusArbitrageMetrics] Initialized");
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordOpportunity(String symbol, boolean tradeable) {
        opportunities.labels(symbol, Boolean.toString(tradeable)).inc();
    }

    @Override
    public void recordTrade(TradeResult result) {
        trades.labels(result.symbol(), result.status().name()).inc();
        tradeDuration.labels(result.symbol()).observe(result.duration().toMillis() / 1000.0);
        netPnl.labels(result.symbol()).inc(result.netPnl().doubleValue());
    }

    @Override
    public void recordMarketDataError(String exchange) {
        marketDataErrors.labels(exchange).inc();
    }

    @Override
    public void recordExecutionSkipped(String symbol, String reason) {
        executionSkipped.labels(symbol, reason).inc();
    }

    @Override
    public void recordError(ErrorSeverity severity) {
        errors.labels(severity.name()).inc();
    }

    @Override
    public void recordEmergency(EmergencyTriggerReason reason) {
        emergencies.labels(reason.name()).inc();
    }

    @Override
    public void setEngineStatus(EngineStatus status) {
        engineStatus.set(status.ordinal());
    }

    @Override
    public void setPoolState(BigDecimal equity, BigDecimal drawdownPercent) {
        poolEquity.set(equity.doubleValue());
        poolDrawdown.set(drawdownPercent.doubleValue());
    }

    @Override
    public void setInFlightExecutions(int count) {
        inFlight.set(count);
    }
}
