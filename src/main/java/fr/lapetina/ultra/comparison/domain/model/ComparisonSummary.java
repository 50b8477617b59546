package fr.lapetina.ultra.comparison.domain.model;

import java.util.Objects;

/**
 * Per-runner scalars for the comparison table. Every field is populated; missing inputs
 * surface as {@link #NOT_AVAILABLE}, {@link #UNKNOWN} or zero.
 */
public record ComparisonSummary(
        String runnerId,
        String averageFatigue,
        String peakFatigueMile,
        int restCount,
        String strongestTerrain,
        String elevationTolerance,
        String restStrategy,
        boolean degraded
) {
    public static final String NOT_AVAILABLE = "N/A";
    public static final String UNKNOWN = "Unknown";

    public ComparisonSummary {
        Objects.requireNonNull(runnerId, "Runner ID is required");
        Objects.requireNonNull(averageFatigue, "Average fatigue is required");
        Objects.requireNonNull(peakFatigueMile, "Peak fatigue mile is required");
        Objects.requireNonNull(strongestTerrain, "Strongest terrain is required");
        Objects.requireNonNull(elevationTolerance, "Elevation tolerance is required");
        Objects.requireNonNull(restStrategy, "Rest strategy is required");
        if (restCount < 0) {
            throw new IllegalArgumentException("Rest count must not be negative");
        }
    }
}
