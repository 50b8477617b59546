package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.Confidence;
import fr.lapetina.ultra.comparison.domain.model.CourseAnalysis;
import fr.lapetina.ultra.comparison.domain.model.FatigueAnalysis;
import fr.lapetina.ultra.comparison.domain.model.RestData;
import fr.lapetina.ultra.comparison.domain.model.RestEvent;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;
import fr.lapetina.ultra.comparison.domain.model.SegmentPerformance;

import java.util.List;

/**
 * Builders for already-ingested analyses used by the stage tests.
 */
final class TestAnalyses {

    private TestAnalyses() {
    }

    static RestEvent rest(double mile, String aidStation, Confidence confidence, double restPace) {
        return RestEvent.builder()
                .mile(mile)
                .nearbyAidStation(aidStation)
                .confidence(confidence)
                .restPace(restPace)
                .build();
    }

    static RestEvent rest(double mile, String aidStation) {
        return rest(mile, aidStation, Confidence.MEDIUM, 0.0);
    }

    static RunnerAnalysis withRests(String runnerId, RestEvent... events) {
        return new RunnerAnalysis(runnerId, null, null, RestData.ofSequence(List.of(events)), null, true);
    }

    static SegmentPerformance segment(String name, double difficulty, double pace, double score) {
        return new SegmentPerformance(name, 0.0, 10.0, "trail", difficulty, pace, score, 0.0, 0.0, 0.0);
    }

    static RunnerAnalysis withSegments(String runnerId, SegmentPerformance... segments) {
        CourseAnalysis course = new CourseAnalysis(null, null, null, List.of(segments));
        return new RunnerAnalysis(runnerId, FatigueAnalysis.absent(), course, RestData.absent(), null, true);
    }
}
