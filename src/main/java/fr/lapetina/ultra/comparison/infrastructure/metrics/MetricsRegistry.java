package fr.lapetina.ultra.comparison.infrastructure.metrics;

import fr.lapetina.ultra.comparison.domain.model.DegradationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Comparison counters by outcome
 * - Partial-data counters by degradation type
 * - Stage latency timers
 * - Rest cluster count distribution
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_REJECTED = "rejected";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> comparisonCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DegradationType, Counter> degradationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final DistributionSummary restClusters;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.restClusters = DistributionSummary.builder(prefix + "_rest_clusters")
                .description("Number of rest clusters per comparison")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ultra_compare");
    }

    /**
     * Increments the comparison counter for an outcome.
     */
    public void incrementComparisons(String outcome) {
        comparisonCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_comparisons_total")
                        .description("Total number of comparisons")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the partial-data counter.
     */
    public void incrementDegradation(DegradationType type) {
        degradationCounters.computeIfAbsent(type, k ->
                Counter.builder(prefix + "_degradations_total")
                        .description("Per-runner partial data absorbed into sentinels")
                        .tag("type", type.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records stage-specific latency (ingestion, clustering, etc.).
     */
    public void recordStageLatency(String stage, Duration latency) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_latency")
                        .description("Pipeline stage latency")
                        .tag("stage", stage)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void recordClusterCount(int clusters) {
        restClusters.record(clusters);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
