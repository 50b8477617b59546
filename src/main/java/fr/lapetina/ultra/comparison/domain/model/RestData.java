package fr.lapetina.ultra.comparison.domain.model;

import java.util.List;

/**
 * Canonical rest information for one runner.
 *
 * <p>The producer sends either a bare sequence of rest events or an object bundling
 * {@code rest_periods}, {@code aid_station_stops} and {@code aid_station_patterns}. Both
 * normalize to this record; {@link #shape()} records which form arrived.
 */
public record RestData(
        List<RestEvent> restEvents,
        List<AidStationStop> aidStationStops,
        AidStationPatterns patterns,
        boolean hasPatterns,
        Shape shape
) {

    public enum Shape {
        /** No rest section supplied */
        ABSENT,
        /** Bare sequence of rest events */
        SEQUENCE,
        /** Object bundling events, stops and patterns */
        BUNDLED
    }

    public RestData {
        restEvents = restEvents != null ? List.copyOf(restEvents) : List.of();
        aidStationStops = aidStationStops != null ? List.copyOf(aidStationStops) : List.of();
        hasPatterns = hasPatterns && patterns != null;
        if (shape == null) {
            shape = Shape.ABSENT;
        }
    }

    public static RestData absent() {
        return new RestData(List.of(), List.of(), null, false, Shape.ABSENT);
    }

    public static RestData ofSequence(List<RestEvent> restEvents) {
        return new RestData(restEvents, List.of(), null, false, Shape.SEQUENCE);
    }

    public static RestData bundled(List<RestEvent> restEvents,
                                   List<AidStationStop> aidStationStops,
                                   AidStationPatterns patterns) {
        return new RestData(restEvents, aidStationStops, patterns, patterns != null, Shape.BUNDLED);
    }

    public int restCount() {
        return restEvents.size();
    }
}
