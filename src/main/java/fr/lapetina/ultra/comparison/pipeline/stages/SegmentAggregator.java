package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.CriticalSegment;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;
import fr.lapetina.ultra.comparison.domain.model.SegmentComparisonRow;
import fr.lapetina.ultra.comparison.domain.model.SegmentPerformance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-runner statistics over named course segments.
 *
 * <p>A runner contributes at most once per segment name (its first segment with that name).
 * Runners lacking a segment are left out of its means rather than counted as zero. Means
 * are summed in ascending value order so they do not depend on runner order.
 */
public final class SegmentAggregator {

    private static final Logger log = LoggerFactory.getLogger(SegmentAggregator.class);

    public static final int DEFAULT_CRITICAL_SEGMENT_LIMIT = 5;

    private final int criticalSegmentLimit;

    public SegmentAggregator() {
        this(DEFAULT_CRITICAL_SEGMENT_LIMIT);
    }

    public SegmentAggregator(int criticalSegmentLimit) {
        if (criticalSegmentLimit < 1) {
            throw new IllegalArgumentException("Critical segment limit must be at least 1: " + criticalSegmentLimit);
        }
        this.criticalSegmentLimit = criticalSegmentLimit;
    }

    public int getCriticalSegmentLimit() {
        return criticalSegmentLimit;
    }

    /**
     * Ranks segments by mean difficulty, hardest first. Equal means keep the order in which
     * the segment names were first encountered.
     */
    public List<CriticalSegment> criticalSegments(List<RunnerAnalysis> runners) {
        Map<String, List<SegmentPerformance>> byName = groupByName(runners);

        List<CriticalSegment> ranked = new ArrayList<>(byName.size());
        for (Map.Entry<String, List<SegmentPerformance>> entry : byName.entrySet()) {
            List<SegmentPerformance> reported = entry.getValue();
            ranked.add(new CriticalSegment(
                    entry.getKey(),
                    mean(reported.stream().mapToDouble(SegmentPerformance::difficultyRating).toArray()),
                    mean(reported.stream().mapToDouble(SegmentPerformance::performanceScore).toArray()),
                    reported.size()
            ));
        }

        // List.sort is stable
        ranked.sort(Comparator.comparingDouble(CriticalSegment::avgDifficulty).reversed());
        List<CriticalSegment> top = ranked.size() > criticalSegmentLimit
                ? List.copyOf(ranked.subList(0, criticalSegmentLimit))
                : List.copyOf(ranked);

        log.debug("Ranked critical segments: distinct={}, kept={}", ranked.size(), top.size());
        return top;
    }

    /**
     * Builds the aligned segment table. The course layout comes from the first runner that
     * reports segments, extended by segments only later runners report.
     */
    public List<SegmentComparisonRow> segmentComparison(List<RunnerAnalysis> runners) {
        Map<String, SegmentPerformance> course = new LinkedHashMap<>();
        for (RunnerAnalysis runner : runners) {
            for (SegmentPerformance segment : runner.courseAnalysis().segmentAnalysis()) {
                course.putIfAbsent(segment.segmentName(), segment);
            }
        }

        List<Map<String, SegmentPerformance>> perRunner = new ArrayList<>(runners.size());
        for (RunnerAnalysis runner : runners) {
            perRunner.add(firstByName(runner));
        }

        List<SegmentComparisonRow> rows = new ArrayList<>(course.size());
        for (SegmentPerformance layout : course.values()) {
            String name = layout.segmentName();
            List<Double> paces = new ArrayList<>();
            Map<String, Double> performance = new LinkedHashMap<>();

            for (int i = 0; i < runners.size(); i++) {
                SegmentPerformance reported = perRunner.get(i).get(name);
                if (reported != null && reported.hasPace()) {
                    paces.add(reported.averagePace());
                }
                Double score = reported != null && reported.performanceScore() > 0.0
                        ? reported.performanceScore()
                        : null;
                performance.put(runners.get(i).runnerId(), score);
            }

            rows.add(new SegmentComparisonRow(
                    name,
                    layout.startMile(),
                    layout.endMile(),
                    layout.terrainType(),
                    layout.difficultyRating(),
                    layout.elevationGainFeet(),
                    layout.elevationLossFeet(),
                    layout.netElevationChangeFeet(),
                    paces.isEmpty() ? null : mean(paces.stream().mapToDouble(Double::doubleValue).toArray()),
                    performance
            ));
        }
        return rows;
    }

    private Map<String, List<SegmentPerformance>> groupByName(List<RunnerAnalysis> runners) {
        Map<String, List<SegmentPerformance>> byName = new LinkedHashMap<>();
        for (RunnerAnalysis runner : runners) {
            for (SegmentPerformance segment : firstByName(runner).values()) {
                byName.computeIfAbsent(segment.segmentName(), k -> new ArrayList<>()).add(segment);
            }
        }
        return byName;
    }

    private static Map<String, SegmentPerformance> firstByName(RunnerAnalysis runner) {
        Map<String, SegmentPerformance> segments = new LinkedHashMap<>();
        for (SegmentPerformance segment : runner.courseAnalysis().segmentAnalysis()) {
            segments.putIfAbsent(segment.segmentName(), segment);
        }
        return segments;
    }

    private static double mean(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double sum = 0.0;
        for (double value : sorted) {
            sum += value;
        }
        return sum / sorted.length;
    }
}
