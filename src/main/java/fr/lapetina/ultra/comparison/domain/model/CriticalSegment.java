package fr.lapetina.ultra.comparison.domain.model;

/**
 * A course segment ranked by mean difficulty across the runners that reported it.
 */
public record CriticalSegment(String name, double avgDifficulty, double avgPerformance, int runnerCount) {
}
