package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.AidStationPatterns;
import fr.lapetina.ultra.comparison.domain.model.ComparisonSummary;
import fr.lapetina.ultra.comparison.domain.model.FatigueAnalysis;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;

import java.util.Locale;

/**
 * Projects one runner's analysis onto the comparison table. Never throws for any ingested
 * analysis; gaps become {@code "N/A"}, {@code "Unknown"} or zero.
 */
public final class SummaryStatsBuilder {

    public ComparisonSummary build(RunnerAnalysis runner, boolean degraded) {
        FatigueAnalysis fatigue = runner.fatigueAnalysis();
        AidStationPatterns patterns = runner.restData().patterns();

        return new ComparisonSummary(
                runner.runnerId(),
                formatFatigue(fatigue.averageFatigue()),
                formatMile(fatigue.peakFatigueMile()),
                runner.restData().restCount(),
                orDefault(runner.courseAnalysis().strongestTerrain(), ComparisonSummary.UNKNOWN),
                orDefault(runner.courseAnalysis().elevationTolerance(), ComparisonSummary.UNKNOWN),
                orDefault(patterns != null ? patterns.restStrategy() : null, ComparisonSummary.NOT_AVAILABLE),
                degraded
        );
    }

    static String formatFatigue(Double value) {
        if (value == null) {
            return ComparisonSummary.NOT_AVAILABLE;
        }
        return String.format(Locale.US, "%.2f", value);
    }

    // Mile 0 is not a meaningful peak
    static String formatMile(Double value) {
        if (value == null || value == 0.0) {
            return ComparisonSummary.NOT_AVAILABLE;
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString(value.longValue());
        }
        return String.valueOf(value.doubleValue());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
