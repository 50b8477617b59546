package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.AidStationStop;
import fr.lapetina.ultra.comparison.domain.model.ComparisonReport;
import fr.lapetina.ultra.comparison.domain.model.ComparisonSummary;
import fr.lapetina.ultra.comparison.domain.model.CriticalSegment;
import fr.lapetina.ultra.comparison.domain.model.FatiguePoint;
import fr.lapetina.ultra.comparison.domain.model.Recommendations;
import fr.lapetina.ultra.comparison.domain.model.RestCluster;
import fr.lapetina.ultra.comparison.domain.model.RestClusterRow;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;
import fr.lapetina.ultra.comparison.domain.model.SegmentComparisonRow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Last stage: combines the outputs of the previous stages into the report.
 */
public final class ComparisonReportAssembler {

    private final RestSelector restSelector;

    public ComparisonReportAssembler(RestSelector restSelector) {
        this.restSelector = Objects.requireNonNull(restSelector, "Rest selector is required");
    }

    public ComparisonReport assemble(
            IngestionResult ingestion,
            double courseLengthMiles,
            Map<String, ComparisonSummary> summaries,
            List<RestCluster> clusters,
            List<CriticalSegment> criticalSegments,
            List<SegmentComparisonRow> segmentComparison
    ) {
        List<String> runnerIds = ingestion.runnerIds();

        List<RestClusterRow> rows = new ArrayList<>(clusters.size());
        for (RestCluster cluster : clusters) {
            rows.add(new RestClusterRow(
                    cluster.meanMile(),
                    cluster.representativeAidStation(),
                    restSelector.selectAll(cluster, runnerIds)
            ));
        }

        Map<String, List<FatiguePoint>> fatigueSeries = new LinkedHashMap<>();
        Map<String, Recommendations> recommendations = new LinkedHashMap<>();
        Map<String, List<AidStationStop>> stops = new LinkedHashMap<>();
        for (RunnerAnalysis runner : ingestion.runners()) {
            if (!runner.available()) {
                continue;
            }
            List<FatiguePoint> progression = runner.fatigueAnalysis().fatigueProgression();
            if (!progression.isEmpty()) {
                fatigueSeries.put(runner.runnerId(), progression);
            }
            if (runner.recommendations().hasContent()) {
                recommendations.put(runner.runnerId(), runner.recommendations());
            }
            List<AidStationStop> runnerStops = runner.restData().aidStationStops();
            if (!runnerStops.isEmpty()) {
                stops.put(runner.runnerId(), runnerStops);
            }
        }

        return new ComparisonReport(
                runnerIds,
                courseLengthMiles,
                summaries,
                rows,
                criticalSegments,
                segmentComparison,
                fatigueSeries,
                recommendations,
                stops
        );
    }
}
