package fr.lapetina.ultra.comparison.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Which runners to compare, in display order, and the course they ran.
 * Immutable; replaces any ambient selection state held by a UI.
 */
public record ComparisonRequest(List<String> selectedRunnerIds, double courseLengthMiles) {

    public ComparisonRequest {
        // copied without List.copyOf so null ids reach validation instead of failing here
        selectedRunnerIds = selectedRunnerIds != null
                ? Collections.unmodifiableList(new ArrayList<>(selectedRunnerIds))
                : List.of();
        if (courseLengthMiles < 0.0 || Double.isNaN(courseLengthMiles)) {
            throw new IllegalArgumentException("Course length must be a non-negative number: " + courseLengthMiles);
        }
    }

    public static ComparisonRequest of(List<String> selectedRunnerIds) {
        return new ComparisonRequest(selectedRunnerIds, 0.0);
    }

    public static ComparisonRequest of(String... selectedRunnerIds) {
        return new ComparisonRequest(List.of(selectedRunnerIds), 0.0);
    }
}
