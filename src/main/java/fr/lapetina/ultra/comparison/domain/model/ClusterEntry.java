package fr.lapetina.ultra.comparison.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One runner's cell in a rest-cluster row: either the representative {@link RestEvent}
 * or a {@link RestPlaceholder} when the runner has no rest in that cluster.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RestEvent.class, name = "rest"),
        @JsonSubTypes.Type(value = RestPlaceholder.class, name = "no_rest")
})
public interface ClusterEntry {

    /**
     * Returns true when no rest was detected for the runner at this location.
     */
    boolean isPlaceholder();
}
