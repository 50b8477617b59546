package fr.lapetina.ultra.comparison.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One aligned row of the rest comparison: exactly one entry per selected runner, in
 * selection order.
 */
public record RestClusterRow(double meanMile, String aidStation, Map<String, ClusterEntry> perRunner) {

    public RestClusterRow {
        perRunner = Collections.unmodifiableMap(new LinkedHashMap<>(perRunner));
    }
}
