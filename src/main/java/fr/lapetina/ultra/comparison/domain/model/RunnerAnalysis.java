package fr.lapetina.ultra.comparison.domain.model;

import java.util.Objects;

/**
 * Canonical per-runner analysis as produced by ingestion.
 * Sections are never null; missing sections are replaced by their {@code absent()} forms.
 */
public record RunnerAnalysis(
        String runnerId,
        FatigueAnalysis fatigueAnalysis,
        CourseAnalysis courseAnalysis,
        RestData restData,
        Recommendations recommendations,
        boolean available
) {
    public RunnerAnalysis {
        Objects.requireNonNull(runnerId, "Runner ID is required");
        if (fatigueAnalysis == null) {
            fatigueAnalysis = FatigueAnalysis.absent();
        }
        if (courseAnalysis == null) {
            courseAnalysis = CourseAnalysis.absent();
        }
        if (restData == null) {
            restData = RestData.absent();
        }
        if (recommendations == null) {
            recommendations = Recommendations.absent();
        }
    }

    /**
     * Creates the stand-in used for a selected runner with no usable analysis.
     */
    public static RunnerAnalysis absent(String runnerId) {
        return new RunnerAnalysis(runnerId, null, null, null, null, false);
    }
}
