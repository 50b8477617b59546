package fr.lapetina.ultra.comparison;

import fr.lapetina.ultra.comparison.api.HttpServer;
import fr.lapetina.ultra.comparison.infrastructure.config.ComparisonConfig;
import fr.lapetina.ultra.comparison.infrastructure.config.ConfigLoader;
import fr.lapetina.ultra.comparison.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ultra.comparison.pipeline.ComparisonPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the ultra-race comparison service.
 */
public class UltraComparisonApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UltraComparisonApplication.class);

    private final ComparisonConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ComparisonPipeline pipeline;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public UltraComparisonApplication(String configPath) throws Exception {
        log.info("Starting ultra comparison service...");

        this.config = new ConfigLoader(configPath).load();

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        this.pipeline = ComparisonPipeline.builder()
                .fromConfig(config)
                .metricsRegistry(metricsRegistry)
                .build();

        this.httpServer = new HttpServer(
                config.getServer().getHost(),
                config.getServer().getPort(),
                config.getServer().getBacklog(),
                config.getServer().getWorkerThreads(),
                pipeline,
                metricsRegistry
        );

        log.info("Ultra comparison service initialized: threshold={}, criticalSegmentLimit={}",
                pipeline.getMileVarianceThreshold(), pipeline.getCriticalSegmentLimit());
    }

    public void start() {
        httpServer.start();
        log.info("Ultra comparison service started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ComparisonPipeline getPipeline() {
        return pipeline;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down ultra comparison service...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("Ultra comparison service shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            UltraComparisonApplication app = new UltraComparisonApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start ultra comparison service", e);
            System.exit(1);
        }
    }
}
