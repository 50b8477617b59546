package fr.lapetina.ultra.comparison.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ultra.comparison.domain.model.ComparisonReport;
import fr.lapetina.ultra.comparison.domain.model.ComparisonRequest;
import fr.lapetina.ultra.comparison.domain.model.ComparisonSummary;
import fr.lapetina.ultra.comparison.domain.model.CriticalSegment;
import fr.lapetina.ultra.comparison.domain.model.PartialDataWarning;
import fr.lapetina.ultra.comparison.domain.model.RestCluster;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;
import fr.lapetina.ultra.comparison.domain.model.SegmentComparisonRow;
import fr.lapetina.ultra.comparison.infrastructure.config.ComparisonConfig;
import fr.lapetina.ultra.comparison.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ultra.comparison.pipeline.exception.ValidationException;
import fr.lapetina.ultra.comparison.pipeline.stages.AnalysisIngestor;
import fr.lapetina.ultra.comparison.pipeline.stages.ComparisonReportAssembler;
import fr.lapetina.ultra.comparison.pipeline.stages.IngestionResult;
import fr.lapetina.ultra.comparison.pipeline.stages.RestPeriodClusterer;
import fr.lapetina.ultra.comparison.pipeline.stages.RestSelector;
import fr.lapetina.ultra.comparison.pipeline.stages.SegmentAggregator;
import fr.lapetina.ultra.comparison.pipeline.stages.SummaryStatsBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point of the comparison engine.
 *
 * <p>Stages run synchronously on the calling thread, in order:
 * <ol>
 *   <li>{@link AnalysisIngestor} - validation and normalization</li>
 *   <li>{@link RestPeriodClusterer} - rest event alignment</li>
 *   <li>{@link SegmentAggregator} - segment ranking and table</li>
 *   <li>{@link SummaryStatsBuilder} - per-runner scalars</li>
 *   <li>{@link ComparisonReportAssembler} - representative selection and assembly</li>
 * </ol>
 *
 * <p>Instances hold no per-request state and may be shared between threads.
 */
public final class ComparisonPipeline {

    private static final Logger log = LoggerFactory.getLogger(ComparisonPipeline.class);

    private final ObjectMapper objectMapper;
    private final AnalysisIngestor ingestor;
    private final RestPeriodClusterer clusterer;
    private final SegmentAggregator segmentAggregator;
    private final SummaryStatsBuilder summaryStatsBuilder;
    private final ComparisonReportAssembler assembler;
    private final MetricsRegistry metricsRegistry;

    private ComparisonPipeline(Builder builder) {
        this.objectMapper = builder.objectMapper;
        this.ingestor = new AnalysisIngestor();
        this.clusterer = new RestPeriodClusterer(builder.mileVarianceThreshold);
        this.segmentAggregator = new SegmentAggregator(builder.criticalSegmentLimit);
        this.summaryStatsBuilder = new SummaryStatsBuilder();
        this.assembler = new ComparisonReportAssembler(new RestSelector());
        this.metricsRegistry = builder.metricsRegistry;
    }

    /**
     * Builds a pipeline with default thresholds and no metrics.
     */
    public static ComparisonPipeline withDefaults() {
        return builder().build();
    }

    /**
     * Runs a comparison over an already parsed payload.
     *
     * @throws ValidationException if the request as a whole is rejected
     */
    public ComparisonReport compare(ComparisonRequest request, JsonNode payload) {
        Instant start = Instant.now();
        try {
            ComparisonReport report = run(request, payload);
            recordOutcome(MetricsRegistry.OUTCOME_SUCCESS);
            log.info("Comparison completed: runners={}, restClusters={}, criticalSegments={}, durationMs={}",
                    report.selectedRunnerIds().size(),
                    report.restClusters().size(),
                    report.criticalSegments().size(),
                    Duration.between(start, Instant.now()).toMillis());
            return report;
        } catch (ValidationException e) {
            recordOutcome(MetricsRegistry.OUTCOME_REJECTED);
            log.info("Comparison rejected: reason={}, message={}", e.getReason(), e.getMessage());
            throw e;
        }
    }

    /**
     * Runs a comparison over a payload given as nested maps and lists.
     */
    public ComparisonReport compare(ComparisonRequest request, Map<String, ?> payload) {
        JsonNode tree = payload != null ? objectMapper.valueToTree(payload) : null;
        return compare(request, tree);
    }

    /**
     * Runs a comparison over a JSON document.
     *
     * @throws ValidationException with reason MALFORMED_PAYLOAD if the document cannot be parsed
     */
    public ComparisonReport compare(ComparisonRequest request, String json) {
        JsonNode tree = null;
        if (json != null && !json.isBlank()) {
            try {
                tree = objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                recordOutcome(MetricsRegistry.OUTCOME_REJECTED);
                throw new ValidationException(ValidationException.Reason.MALFORMED_PAYLOAD,
                        e.getOriginalMessage(), e);
            }
        }
        return compare(request, tree);
    }

    private ComparisonReport run(ComparisonRequest request, JsonNode payload) {
        IngestionResult ingestion = timed("ingestion", () -> ingestor.ingest(request, payload));
        recordWarnings(ingestion.warnings());

        List<RunnerAnalysis> runners = ingestion.runners();

        List<RestCluster> clusters = timed("clustering", () -> clusterer.cluster(runners));
        if (metricsRegistry != null) {
            metricsRegistry.recordClusterCount(clusters.size());
        }

        List<CriticalSegment> criticalSegments = timed("segments",
                () -> segmentAggregator.criticalSegments(runners));
        List<SegmentComparisonRow> segmentComparison = timed("segment_table",
                () -> segmentAggregator.segmentComparison(runners));

        Map<String, ComparisonSummary> summaries = timed("summaries", () -> {
            Map<String, ComparisonSummary> built = new LinkedHashMap<>();
            for (RunnerAnalysis runner : runners) {
                built.put(runner.runnerId(),
                        summaryStatsBuilder.build(runner, ingestion.isDegraded(runner.runnerId())));
            }
            return built;
        });

        return timed("assembly", () -> assembler.assemble(
                ingestion,
                request.courseLengthMiles(),
                summaries,
                clusters,
                criticalSegments,
                segmentComparison
        ));
    }

    private <T> T timed(String stage, Supplier<T> body) {
        Instant start = Instant.now();
        T result = body.get();
        Duration elapsed = Duration.between(start, Instant.now());
        log.debug("Stage completed: stage={}, durationMicros={}", stage, elapsed.toNanos() / 1_000);
        if (metricsRegistry != null) {
            metricsRegistry.recordStageLatency(stage, elapsed);
        }
        return result;
    }

    private void recordWarnings(List<PartialDataWarning> warnings) {
        if (metricsRegistry == null) {
            return;
        }
        for (PartialDataWarning warning : warnings) {
            metricsRegistry.incrementDegradation(warning.type());
        }
    }

    private void recordOutcome(String outcome) {
        if (metricsRegistry != null) {
            metricsRegistry.incrementComparisons(outcome);
        }
    }

    public double getMileVarianceThreshold() {
        return clusterer.getMileVarianceThreshold();
    }

    public int getCriticalSegmentLimit() {
        return segmentAggregator.getCriticalSegmentLimit();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double mileVarianceThreshold = RestPeriodClusterer.DEFAULT_MILE_VARIANCE_THRESHOLD;
        private int criticalSegmentLimit = SegmentAggregator.DEFAULT_CRITICAL_SEGMENT_LIMIT;
        private MetricsRegistry metricsRegistry;
        private ObjectMapper objectMapper;

        public Builder mileVarianceThreshold(double threshold) {
            this.mileVarianceThreshold = threshold;
            return this;
        }

        public Builder criticalSegmentLimit(int limit) {
            this.criticalSegmentLimit = limit;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.objectMapper = mapper;
            return this;
        }

        public Builder fromConfig(ComparisonConfig config) {
            this.mileVarianceThreshold = config.getClustering().getMileVarianceThreshold();
            this.criticalSegmentLimit = config.getSegments().getCriticalSegmentLimit();
            return this;
        }

        public ComparisonPipeline build() {
            if (objectMapper == null) {
                objectMapper = new ObjectMapper();
            }
            return new ComparisonPipeline(this);
        }
    }
}
