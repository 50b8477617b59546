package fr.lapetina.ultra.comparison.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the aligned segment table.
 *
 * <p>{@code averagePace} is null when no runner reported a positive pace for the segment.
 * {@code performanceByRunner} holds every selected runner; the value is null when the runner
 * lacks the segment or reported a zero score.
 */
public record SegmentComparisonRow(
        String segmentName,
        double startMile,
        double endMile,
        String terrainType,
        double difficultyRating,
        double elevationGainFeet,
        double elevationLossFeet,
        double netElevationChangeFeet,
        Double averagePace,
        Map<String, Double> performanceByRunner
) {
    public SegmentComparisonRow {
        performanceByRunner = Collections.unmodifiableMap(new LinkedHashMap<>(performanceByRunner));
    }
}
