package fr.lapetina.ultra.comparison.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final result of one comparison, handed as-is to the presentation layer.
 * Maps iterate in runner selection order.
 */
public record ComparisonReport(
        List<String> selectedRunnerIds,
        double courseLengthMiles,
        Map<String, ComparisonSummary> perRunnerSummary,
        List<RestClusterRow> restClusters,
        List<CriticalSegment> criticalSegments,
        List<SegmentComparisonRow> segmentComparison,
        Map<String, List<FatiguePoint>> fatigueSeries,
        Map<String, Recommendations> perRunnerRecommendations,
        Map<String, List<AidStationStop>> aidStationStops
) {
    public ComparisonReport {
        selectedRunnerIds = List.copyOf(selectedRunnerIds);
        perRunnerSummary = Collections.unmodifiableMap(new LinkedHashMap<>(perRunnerSummary));
        restClusters = List.copyOf(restClusters);
        criticalSegments = List.copyOf(criticalSegments);
        segmentComparison = List.copyOf(segmentComparison);
        fatigueSeries = Collections.unmodifiableMap(new LinkedHashMap<>(fatigueSeries));
        perRunnerRecommendations = Collections.unmodifiableMap(new LinkedHashMap<>(perRunnerRecommendations));
        aidStationStops = Collections.unmodifiableMap(new LinkedHashMap<>(aidStationStops));
    }
}
