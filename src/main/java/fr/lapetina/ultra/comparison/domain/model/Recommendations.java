package fr.lapetina.ultra.comparison.domain.model;

import java.util.List;

/**
 * Producer pacing advice for one runner, echoed in the report next to the computed
 * critical segments. The ranking itself only uses {@link SegmentPerformance} data.
 */
public record Recommendations(
        String overallStrategy,
        List<SegmentRecommendation> segmentRecommendations,
        List<String> criticalSegments
) {
    public Recommendations {
        segmentRecommendations = segmentRecommendations != null ? List.copyOf(segmentRecommendations) : List.of();
        criticalSegments = criticalSegments != null ? List.copyOf(criticalSegments) : List.of();
    }

    public static Recommendations absent() {
        return new Recommendations(null, List.of(), List.of());
    }

    /**
     * Returns true when at least one piece of advice was supplied.
     */
    public boolean hasContent() {
        return (overallStrategy != null && !overallStrategy.isBlank())
                || !segmentRecommendations.isEmpty()
                || !criticalSegments.isEmpty();
    }

    public record SegmentRecommendation(
            String segment,
            String terrain,
            double difficulty,
            double recommendedEffort,
            String keyStrategy
    ) {
    }
}
