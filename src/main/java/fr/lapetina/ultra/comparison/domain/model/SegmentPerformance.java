package fr.lapetina.ultra.comparison.domain.model;

import java.util.Objects;

/**
 * A runner's performance over one named course segment.
 * {@code segmentName} is the identity key shared by runners on the same course.
 */
public record SegmentPerformance(
        String segmentName,
        double startMile,
        double endMile,
        String terrainType,
        double difficultyRating,
        double averagePace,
        double performanceScore,
        double elevationGainFeet,
        double elevationLossFeet,
        double netElevationChangeFeet
) {
    public static final double MAX_DIFFICULTY = 5.0;

    public SegmentPerformance {
        Objects.requireNonNull(segmentName, "Segment name is required");
        if (difficultyRating < 0.0 || difficultyRating > MAX_DIFFICULTY) {
            throw new IllegalArgumentException("Difficulty rating out of range [0,5]: " + difficultyRating);
        }
        if (performanceScore < 0.0 || performanceScore > 1.0) {
            throw new IllegalArgumentException("Performance score out of range [0,1]: " + performanceScore);
        }
        if (averagePace < 0.0) {
            throw new IllegalArgumentException("Average pace must not be negative: " + averagePace);
        }
    }

    /**
     * Returns true when the runner reported a usable pace for this segment.
     */
    public boolean hasPace() {
        return averagePace > 0.0;
    }
}
