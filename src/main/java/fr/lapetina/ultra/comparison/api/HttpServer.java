package fr.lapetina.ultra.comparison.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.ultra.comparison.api.dto.ComparisonApiRequest;
import fr.lapetina.ultra.comparison.domain.model.ComparisonReport;
import fr.lapetina.ultra.comparison.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ultra.comparison.pipeline.ComparisonPipeline;
import fr.lapetina.ultra.comparison.pipeline.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /api/comparison - Compare the selected runners
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ComparisonPipeline pipeline;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int workerThreads,
            ComparisonPipeline pipeline,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.pipeline = pipeline;
        this.metricsRegistry = metricsRegistry;
        this.objectMapper = new ObjectMapper();

        this.server = com.sun.net.httpserver.HttpServer.create(
                bindAddress(host, port), backlog
        );

        this.executor = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/api/comparison", new ComparisonHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured: host={}, port={}", host, getPort());
    }

    private static InetSocketAddress bindAddress(String host, int port) {
        // Blank host binds every interface
        return host == null || host.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(host, port);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Returns the bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    public InetSocketAddress getAddress() {
        return server.getAddress();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== COMPARISON HANDLER ====================

    private class ComparisonHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                // Parse request
                ComparisonApiRequest apiRequest;
                try (InputStream is = exchange.getRequestBody()) {
                    apiRequest = objectMapper.readValue(is, ComparisonApiRequest.class);
                } catch (JsonProcessingException e) {
                    log.warn("Rejected unparseable request body: {}", e.getOriginalMessage());
                    sendError(exchange, 400, "Malformed JSON: " + e.getOriginalMessage());
                    return;
                }

                ComparisonReport report = pipeline.compare(
                        apiRequest.toComparisonRequest(), apiRequest.getAnalyses());
                sendJson(exchange, 200, report);

            } catch (ValidationException e) {
                log.warn("Comparison rejected: {}", e.getMessage());
                Map<String, String> error = new LinkedHashMap<>();
                error.put("error", e.getMessage());
                error.put("reason", e.getReason().name());
                sendJson(exchange, 400, error);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid comparison request: {}", e.getMessage());
                sendError(exchange, 400, e.getMessage());
            } catch (Exception e) {
                log.error("Error handling comparison request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("timestamp", System.currentTimeMillis());
            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            if (metricsRegistry == null) {
                sendError(exchange, 404, "Metrics disabled");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "http-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
