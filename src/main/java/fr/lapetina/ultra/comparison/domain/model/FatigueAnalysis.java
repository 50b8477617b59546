package fr.lapetina.ultra.comparison.domain.model;

import java.util.List;

/**
 * Precomputed fatigue figures for one runner. Scalar fields are null when the producer
 * omitted them.
 */
public record FatigueAnalysis(
        Double averageFatigue,
        Double peakFatigueMile,
        List<FatiguePoint> fatigueProgression
) {
    public FatigueAnalysis {
        fatigueProgression = fatigueProgression != null ? List.copyOf(fatigueProgression) : List.of();
    }

    public static FatigueAnalysis absent() {
        return new FatigueAnalysis(null, null, List.of());
    }
}
