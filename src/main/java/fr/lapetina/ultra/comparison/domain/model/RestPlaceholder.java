package fr.lapetina.ultra.comparison.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Explicit "no rest detected" marker for a runner that contributed nothing to a rest cluster.
 * Carries the cluster's mean mile and a representative aid-station name so the row stays
 * fully populated.
 */
public record RestPlaceholder(double mile, String aidStation, String reason) implements ClusterEntry {

    public static final String NO_REST_DETECTED = "No rest detected";

    public RestPlaceholder {
        Objects.requireNonNull(aidStation, "Aid station is required");
        if (reason == null) {
            reason = NO_REST_DETECTED;
        }
    }

    public static RestPlaceholder at(double mile, String aidStation) {
        return new RestPlaceholder(mile, aidStation, NO_REST_DETECTED);
    }

    @Override
    @JsonIgnore
    public boolean isPlaceholder() {
        return true;
    }
}
