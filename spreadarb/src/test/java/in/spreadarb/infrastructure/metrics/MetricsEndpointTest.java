package in.spreadarb.infrastructure.metrics;

import in.spreadarb.domain.common.ErrorSeverity;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.support.Fixtures;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private MetricsServer server;
    private PrometheusArbitrageMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusArbitrageMetrics(new CollectorRegistry());
        server = new MetricsServer("localhost", TEST_PORT, metrics.getRegistry());
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be Prometheus text format");
        assertTrue(response.body().contains("# HELP"), "Metrics should contain HELP declarations");
        assertTrue(response.body().contains("arb_engine_status"), "Unlabelled gauges are always exported");
    }

    @Test
    public void testMetricsRecordingAndExport() throws Exception {
        metrics.recordOpportunity("BTC/USDT", true);
        metrics.recordTrade(Fixtures.trade("0.5", Instant.now()));
        metrics.recordExecutionSkipped("BTC/USDT", "pair_busy");
        metrics.recordMarketDataError("SIM_B");
        metrics.recordError(ErrorSeverity.CRITICAL);
        metrics.recordEmergency(EmergencyTriggerReason.CONSECUTIVE_LOSSES);
        metrics.setEngineStatus(EngineStatus.RUNNING);
        metrics.setPoolState(new BigDecimal("20000"), new BigDecimal("1.5"));
        metrics.setInFlightExecutions(1);

        String body = scrape().body();

        assertTrue(body.contains("arb_opportunities_total{symbol=\"BTC/USDT\",tradeable=\"true\",} 1.0"),
            "Should count tradeable opportunities");
        assertTrue(body.contains("arb_trades_total{symbol=\"BTC/USDT\",status=\"SUCCESS\",} 1.0"),
            "Should count trades by status");
        assertTrue(body.contains("arb_trade_duration_seconds_count{symbol=\"BTC/USDT\",} 1.0"),
            "Should observe trade duration");
        assertTrue(body.contains("arb_execution_skipped_total{symbol=\"BTC/USDT\",reason=\"pair_busy\",} 1.0"));
        assertTrue(body.contains("arb_market_data_errors_total{exchange=\"SIM_B\",} 1.0"));
        assertTrue(body.contains("arb_errors_total{severity=\"CRITICAL\",} 1.0"));
        assertTrue(body.contains("arb_emergency_triggers_total{reason=\"CONSECUTIVE_LOSSES\",} 1.0"));
        assertTrue(body.contains("arb_engine_status 2.0"), "RUNNING ordinal");
        assertTrue(body.contains("arb_pool_equity 20000.0"));
        assertTrue(body.contains("arb_executions_in_flight 1.0"));
    }
}
