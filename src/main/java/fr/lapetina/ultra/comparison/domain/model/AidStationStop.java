package fr.lapetina.ultra.comparison.domain.model;

/**
 * A rest event that the producer matched to a named aid station.
 */
public record AidStationStop(
        String stationName,
        double mile,
        double restDurationMinutes,
        boolean sleepStation,
        boolean crewStation,
        String restType
) {
}
