package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.ClusterEntry;
import fr.lapetina.ultra.comparison.domain.model.ClusteredRest;
import fr.lapetina.ultra.comparison.domain.model.RestCluster;
import fr.lapetina.ultra.comparison.domain.model.RestPlaceholder;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks one representative rest record, or a placeholder, per runner per cluster.
 *
 * Preference order, best first:
 * - Higher confidence tier
 * - Higher rest pace
 * - Closer to the cluster mean mile
 * - Lower mile
 * - Earlier in the flattened input
 */
public final class RestSelector {

    public ClusterEntry select(RestCluster cluster, String runnerId) {
        List<ClusteredRest> candidates = cluster.membersFor(runnerId);
        if (candidates.isEmpty()) {
            return RestPlaceholder.at(cluster.meanMile(), cluster.representativeAidStation());
        }
        if (candidates.size() == 1) {
            return candidates.get(0).event();
        }
        return candidates.stream()
                .min(preference(cluster.meanMile()))
                .orElseThrow()
                .event();
    }

    /**
     * Selects for every runner, keyed in the given order. The result always holds exactly one
     * entry per distinct runner id.
     */
    public Map<String, ClusterEntry> selectAll(RestCluster cluster, List<String> runnerIds) {
        Map<String, ClusterEntry> selected = new LinkedHashMap<>();
        for (String runnerId : runnerIds) {
            selected.computeIfAbsent(runnerId, id -> select(cluster, id));
        }
        return selected;
    }

    /**
     * Total order over the members of one cluster; the smallest element is preferred.
     */
    public static Comparator<ClusteredRest> preference(double meanMile) {
        return Comparator.<ClusteredRest>comparingInt(r -> -r.event().confidence().rank())
                .thenComparing(r -> r.event().restPace(), Comparator.reverseOrder())
                .thenComparingDouble(r -> Math.abs(r.mile() - meanMile))
                .thenComparingDouble(ClusteredRest::mile)
                .thenComparingInt(ClusteredRest::encounterIndex);
    }
}
