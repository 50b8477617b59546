package fr.lapetina.ultra.comparison.domain.model;

import java.util.List;

/**
 * Precomputed course-impact figures for one runner.
 */
public record CourseAnalysis(
        String strongestTerrain,
        String weakestTerrain,
        String elevationTolerance,
        List<SegmentPerformance> segmentAnalysis
) {
    public CourseAnalysis {
        segmentAnalysis = segmentAnalysis != null ? List.copyOf(segmentAnalysis) : List.of();
    }

    public static CourseAnalysis absent() {
        return new CourseAnalysis(null, null, null, List.of());
    }
}
