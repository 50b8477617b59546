package fr.lapetina.ultra.comparison.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.ultra.comparison.domain.model.ComparisonRequest;

import java.util.List;

/**
 * API request DTO for {@code POST /api/comparison}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComparisonApiRequest {

    @JsonProperty("selected_runner_ids")
    private List<String> selectedRunnerIds;

    @JsonProperty("course_length_miles")
    private Double courseLengthMiles;

    // Envelope or bare map, handed to the pipeline untouched
    private JsonNode analyses;

    // Getters and setters
    public List<String> getSelectedRunnerIds() { return selectedRunnerIds; }
    public void setSelectedRunnerIds(List<String> selectedRunnerIds) { this.selectedRunnerIds = selectedRunnerIds; }

    public Double getCourseLengthMiles() { return courseLengthMiles; }
    public void setCourseLengthMiles(Double courseLengthMiles) { this.courseLengthMiles = courseLengthMiles; }

    public JsonNode getAnalyses() { return analyses; }
    public void setAnalyses(JsonNode analyses) { this.analyses = analyses; }

    /**
     * Converts to domain ComparisonRequest.
     */
    public ComparisonRequest toComparisonRequest() {
        return new ComparisonRequest(
                selectedRunnerIds,
                courseLengthMiles != null ? courseLengthMiles : 0.0
        );
    }
}
