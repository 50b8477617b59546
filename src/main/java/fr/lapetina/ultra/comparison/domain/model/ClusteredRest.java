package fr.lapetina.ultra.comparison.domain.model;

import java.util.Objects;

/**
 * A rest event tagged with its runner and its position in the flattened input.
 * {@code encounterIndex} is the final tie-breaker during representative selection.
 */
public record ClusteredRest(String runnerId, RestEvent event, int encounterIndex) {

    public ClusteredRest {
        Objects.requireNonNull(runnerId, "Runner ID is required");
        Objects.requireNonNull(event, "Event is required");
        if (!event.hasMile()) {
            throw new IllegalArgumentException("Clustered rest events must carry a mile");
        }
    }

    public double mile() {
        return event.mile();
    }
}
