package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.AidStationPatterns;
import fr.lapetina.ultra.comparison.domain.model.ComparisonSummary;
import fr.lapetina.ultra.comparison.domain.model.CourseAnalysis;
import fr.lapetina.ultra.comparison.domain.model.FatigueAnalysis;
import fr.lapetina.ultra.comparison.domain.model.RestData;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static fr.lapetina.ultra.comparison.pipeline.stages.TestAnalyses.rest;
import static org.assertj.core.api.Assertions.assertThat;

class SummaryStatsBuilderTest {

    private final SummaryStatsBuilder builder = new SummaryStatsBuilder();

    @Test
    @DisplayName("should project a complete analysis")
    void shouldProjectCompleteAnalysis() {
        RunnerAnalysis runner = new RunnerAnalysis(
                "101",
                new FatigueAnalysis(1.2345, 77.3, List.of()),
                new CourseAnalysis("technical_climb", "road", "high", List.of()),
                RestData.bundled(
                        List.of(rest(77.3, "Whiskey Row"), rest(120.0, "Finish")),
                        List.of(),
                        new AidStationPatterns(2, 0, 1, "Whiskey Row", 30.0, "Crew-focused")),
                null,
                true
        );

        ComparisonSummary summary = builder.build(runner, false);

        assertThat(summary.runnerId()).isEqualTo("101");
        assertThat(summary.averageFatigue()).isEqualTo("1.23");
        assertThat(summary.peakFatigueMile()).isEqualTo("77.3");
        assertThat(summary.restCount()).isEqualTo(2);
        assertThat(summary.strongestTerrain()).isEqualTo("technical_climb");
        assertThat(summary.elevationTolerance()).isEqualTo("high");
        assertThat(summary.restStrategy()).isEqualTo("Crew-focused");
        assertThat(summary.degraded()).isFalse();
    }

    @Test
    @DisplayName("should fall back to sentinels for an absent analysis")
    void shouldUseSentinels() {
        ComparisonSummary summary = builder.build(RunnerAnalysis.absent("303"), true);

        assertThat(summary.averageFatigue()).isEqualTo(ComparisonSummary.NOT_AVAILABLE);
        assertThat(summary.peakFatigueMile()).isEqualTo(ComparisonSummary.NOT_AVAILABLE);
        assertThat(summary.restCount()).isZero();
        assertThat(summary.strongestTerrain()).isEqualTo(ComparisonSummary.UNKNOWN);
        assertThat(summary.elevationTolerance()).isEqualTo(ComparisonSummary.UNKNOWN);
        assertThat(summary.restStrategy()).isEqualTo(ComparisonSummary.NOT_AVAILABLE);
        assertThat(summary.degraded()).isTrue();
    }

    @Test
    @DisplayName("should count rests from a bare sequence")
    void shouldCountSequenceRests() {
        RunnerAnalysis runner = new RunnerAnalysis("202", null, null,
                RestData.ofSequence(List.of(rest(10.0, "A"), rest(20.0, "B"), rest(30.0, "C"))), null, true);

        assertThat(builder.build(runner, false).restCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("should treat blank terrain as unknown")
    void shouldTreatBlankAsUnknown() {
        RunnerAnalysis runner = new RunnerAnalysis("202", null,
                new CourseAnalysis(" ", null, "", List.of()), null, null, true);

        ComparisonSummary summary = builder.build(runner, false);

        assertThat(summary.strongestTerrain()).isEqualTo(ComparisonSummary.UNKNOWN);
        assertThat(summary.elevationTolerance()).isEqualTo(ComparisonSummary.UNKNOWN);
    }

    @Test
    @DisplayName("should format fatigue with two decimals")
    void shouldFormatFatigue() {
        assertThat(SummaryStatsBuilder.formatFatigue(1.0)).isEqualTo("1.00");
        assertThat(SummaryStatsBuilder.formatFatigue(0.0)).isEqualTo("0.00");
        assertThat(SummaryStatsBuilder.formatFatigue(2.456)).isEqualTo("2.46");
        assertThat(SummaryStatsBuilder.formatFatigue(null)).isEqualTo("N/A");
    }

    @Test
    @DisplayName("should format the peak mile without trailing zeros")
    void shouldFormatPeakMile() {
        assertThat(SummaryStatsBuilder.formatMile(45.0)).isEqualTo("45");
        assertThat(SummaryStatsBuilder.formatMile(45.5)).isEqualTo("45.5");
        assertThat(SummaryStatsBuilder.formatMile(0.0)).isEqualTo("N/A");
        assertThat(SummaryStatsBuilder.formatMile(null)).isEqualTo("N/A");
    }
}
