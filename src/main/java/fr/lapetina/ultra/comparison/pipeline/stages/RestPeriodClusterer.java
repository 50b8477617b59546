package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.ClusteredRest;
import fr.lapetina.ultra.comparison.domain.model.RestCluster;
import fr.lapetina.ultra.comparison.domain.model.RestEvent;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups rest events of all selected runners into aid-station anchored clusters.
 *
 * <p>Algorithm (single pass, greedy):
 * <ol>
 *   <li>Flatten events in selection order, then per-runner event order; events without a
 *       mile are skipped.</li>
 *   <li>Stable-sort by mile.</li>
 *   <li>For each event, join the first open cluster (in creation order) with the same
 *       aid-station identity whose current mean mile is within the threshold; otherwise
 *       open a new cluster. The mean is updated as each event joins.</li>
 *   <li>Sort clusters by final mean mile.</li>
 * </ol>
 *
 * <p>This is a local, order-dependent heuristic, not an optimal clustering. An event near
 * the threshold is placed according to the mean at the moment it is processed, and a
 * cluster's mean may later drift so that early members end up further than the threshold
 * from it. Callers and tests rely on this behavior; do not replace it with a
 * variance-minimizing method without revisiting them.
 */
public final class RestPeriodClusterer {

    private static final Logger log = LoggerFactory.getLogger(RestPeriodClusterer.class);

    public static final double DEFAULT_MILE_VARIANCE_THRESHOLD = 5.0;

    private final double mileVarianceThreshold;

    public RestPeriodClusterer() {
        this(DEFAULT_MILE_VARIANCE_THRESHOLD);
    }

    public RestPeriodClusterer(double mileVarianceThreshold) {
        if (!(mileVarianceThreshold > 0.0)) {
            throw new IllegalArgumentException("Mile variance threshold must be positive: " + mileVarianceThreshold);
        }
        this.mileVarianceThreshold = mileVarianceThreshold;
    }

    public double getMileVarianceThreshold() {
        return mileVarianceThreshold;
    }

    public List<RestCluster> cluster(List<RunnerAnalysis> runners) {
        List<ClusteredRest> events = flatten(runners);
        events.sort(Comparator.comparingDouble(ClusteredRest::mile));

        List<OpenCluster> open = new ArrayList<>();
        for (ClusteredRest rest : events) {
            OpenCluster target = findCluster(open, rest);
            if (target == null) {
                target = new OpenCluster(rest.event().aidStationIdentity());
                open.add(target);
            }
            target.add(rest);
        }

        List<RestCluster> clusters = new ArrayList<>(open.size());
        for (OpenCluster cluster : open) {
            clusters.add(cluster.toCluster());
        }
        clusters.sort(Comparator.comparingDouble(RestCluster::meanMile));

        log.debug("Clustered rest events: events={}, clusters={}, threshold={}",
                events.size(), clusters.size(), mileVarianceThreshold);
        return clusters;
    }

    private List<ClusteredRest> flatten(List<RunnerAnalysis> runners) {
        List<ClusteredRest> events = new ArrayList<>();
        int encounterIndex = 0;
        for (RunnerAnalysis runner : runners) {
            for (RestEvent event : runner.restData().restEvents()) {
                if (event.hasMile()) {
                    events.add(new ClusteredRest(runner.runnerId(), event, encounterIndex++));
                }
            }
        }
        return events;
    }

    private OpenCluster findCluster(List<OpenCluster> open, ClusteredRest rest) {
        String identity = rest.event().aidStationIdentity();
        for (OpenCluster cluster : open) {
            if (cluster.identity.equals(identity)
                    && Math.abs(rest.mile() - cluster.meanMile()) <= mileVarianceThreshold) {
                return cluster;
            }
        }
        return null;
    }

    /**
     * Cluster under construction. Never escapes this stage.
     */
    private static final class OpenCluster {
        private final String identity;
        private final List<ClusteredRest> members = new ArrayList<>();
        private double mileSum;

        OpenCluster(String identity) {
            this.identity = identity;
        }

        void add(ClusteredRest rest) {
            members.add(rest);
            mileSum += rest.mile();
        }

        double meanMile() {
            return mileSum / members.size();
        }

        RestCluster toCluster() {
            return new RestCluster(identity, meanMile(), members);
        }
    }
}
