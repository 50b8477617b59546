package fr.lapetina.ultra.comparison.domain.model;

import java.util.Objects;

/**
 * A recoverable data fault isolated to one runner.
 */
public record PartialDataWarning(String runnerId, DegradationType type, String detail) {

    public PartialDataWarning {
        Objects.requireNonNull(runnerId, "Runner ID is required");
        Objects.requireNonNull(type, "Degradation type is required");
    }
}
