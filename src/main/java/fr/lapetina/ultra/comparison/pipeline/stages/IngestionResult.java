package fr.lapetina.ultra.comparison.pipeline.stages;

import fr.lapetina.ultra.comparison.domain.model.PartialDataWarning;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;

import java.util.List;

/**
 * Output of {@link AnalysisIngestor}: one canonical analysis per selected runner, in
 * selection order, plus the degradations absorbed along the way.
 */
public record IngestionResult(List<RunnerAnalysis> runners, List<PartialDataWarning> warnings) {

    public IngestionResult {
        runners = List.copyOf(runners);
        warnings = List.copyOf(warnings);
    }

    public List<String> runnerIds() {
        return runners.stream().map(RunnerAnalysis::runnerId).toList();
    }

    public boolean isDegraded(String runnerId) {
        return warnings.stream().anyMatch(w -> w.runnerId().equals(runnerId));
    }
}
