package fr.lapetina.ultra.comparison.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Rest events from several runners judged to be the same real-world stop: identical
 * aid-station identity, each within the variance threshold of the running mean mile at the
 * time it joined. Request-scoped and immutable once built.
 */
public record RestCluster(String aidStation, double meanMile, List<ClusteredRest> members) {

    public RestCluster {
        Objects.requireNonNull(aidStation, "Aid station identity is required");
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A rest cluster needs at least one member");
        }
    }

    public List<ClusteredRest> membersFor(String runnerId) {
        return members.stream()
                .filter(m -> m.runnerId().equals(runnerId))
                .toList();
    }

    /**
     * Returns the first aid-station name reported by any member, or the unknown sentinel.
     */
    public String representativeAidStation() {
        return members.stream()
                .map(m -> m.event().nearbyAidStation())
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(RestEvent.UNKNOWN_AID_STATION);
    }
}
