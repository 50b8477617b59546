package fr.lapetina.ultra.comparison.domain.model;

/**
 * Producer-side summary of how a runner used aid stations over the whole race.
 */
public record AidStationPatterns(
        int totalAidStationStops,
        int sleepStationUsage,
        int crewRestUsage,
        String longestRestStation,
        double longestRestDuration,
        String restStrategy
) {
}
