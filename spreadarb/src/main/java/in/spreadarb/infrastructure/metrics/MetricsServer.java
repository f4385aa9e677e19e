package in.spreadarb.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal Undertow server exposing /metrics.
 */
public final class MetricsServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);

    private final Undertow server;
    private final int port;

    public MetricsServer(String host, int port, CollectorRegistry registry) {
        this.port = port;
        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(Handlers.path().addPrefixPath("/metrics", new PrometheusMetricsHandler(registry)))
            .build();
    }

    public void start() {
        server.start();
        log.info("✅ Metrics endpoint listening on port {} at /metrics", port);
    }

    @Override
    public void close() {
        server.stop();
        log.info("Metrics endpoint stopped");
    }
}
