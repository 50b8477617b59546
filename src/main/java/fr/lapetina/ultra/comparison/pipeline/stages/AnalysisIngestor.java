package fr.lapetina.ultra.comparison.pipeline.stages;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import fr.lapetina.ultra.comparison.domain.model.AidStationPatterns;
import fr.lapetina.ultra.comparison.domain.model.AidStationStop;
import fr.lapetina.ultra.comparison.domain.model.ComparisonRequest;
import fr.lapetina.ultra.comparison.domain.model.Confidence;
import fr.lapetina.ultra.comparison.domain.model.CourseAnalysis;
import fr.lapetina.ultra.comparison.domain.model.DegradationType;
import fr.lapetina.ultra.comparison.domain.model.FatigueAnalysis;
import fr.lapetina.ultra.comparison.domain.model.FatiguePoint;
import fr.lapetina.ultra.comparison.domain.model.PartialDataWarning;
import fr.lapetina.ultra.comparison.domain.model.Recommendations;
import fr.lapetina.ultra.comparison.domain.model.RestData;
import fr.lapetina.ultra.comparison.domain.model.RestEvent;
import fr.lapetina.ultra.comparison.domain.model.RestType;
import fr.lapetina.ultra.comparison.domain.model.RunnerAnalysis;
import fr.lapetina.ultra.comparison.domain.model.SegmentPerformance;
import fr.lapetina.ultra.comparison.pipeline.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * First stage: validates the raw analytics payload and normalizes each selected runner's
 * analysis into a canonical {@link RunnerAnalysis}.
 *
 * Fails the request only when:
 * - No runners are selected
 * - The payload status is "failed"
 * - The payload is not a JSON object
 *
 * Every other fault is isolated to the runner it belongs to: the missing section is
 * replaced by its absent form and a {@link PartialDataWarning} is recorded.
 *
 * This is the only place that knows the producer's field names and their fallbacks
 * ({@code mile}/{@code start_mile}, {@code pace_during}/{@code actual_pace}, ...).
 */
public final class AnalysisIngestor {

    private static final Logger log = LoggerFactory.getLogger(AnalysisIngestor.class);

    static final String FAILED_STATUS = "failed";

    private static final String FATIGUE_SECTION = "fatigue_analysis";
    private static final String COURSE_SECTION = "course_analysis";

    /**
     * Normalizes the analyses of the selected runners.
     *
     * @param request selection and course context
     * @param payload either the producer envelope ({@code {status, error, analyses}}) or a
     *                bare map of runner id to analysis; null is treated as an empty map
     * @return one analysis per distinct selected runner, in selection order
     * @throws ValidationException on a request-level failure
     */
    public IngestionResult ingest(ComparisonRequest request, JsonNode payload) {
        List<String> selected = selectedRunners(request);
        JsonNode analyses = analysesOf(payload);

        List<RunnerAnalysis> runners = new ArrayList<>(selected.size());
        List<PartialDataWarning> warnings = new ArrayList<>();
        for (String runnerId : selected) {
            Degradations degradations = new Degradations(runnerId, warnings);
            runners.add(ingestRunner(runnerId, analyses.get(runnerId), degradations));
        }

        log.debug("Ingestion completed: runners={}, warnings={}", runners.size(), warnings.size());
        return new IngestionResult(runners, warnings);
    }

    private List<String> selectedRunners(ComparisonRequest request) {
        if (request == null || request.selectedRunnerIds().isEmpty()) {
            throw new ValidationException(ValidationException.Reason.NO_RUNNERS_SELECTED);
        }

        Set<String> unique = new LinkedHashSet<>();
        for (String runnerId : request.selectedRunnerIds()) {
            if (runnerId == null || runnerId.isBlank()) {
                log.warn("Ignoring blank runner id in selection");
                continue;
            }
            if (!unique.add(runnerId.trim())) {
                log.debug("Duplicate runner id in selection: runnerId={}", runnerId);
            }
        }

        if (unique.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.NO_RUNNERS_SELECTED,
                    "selection contains only blank ids");
        }
        return List.copyOf(unique);
    }

    private JsonNode analysesOf(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!payload.isObject()) {
            throw new ValidationException(ValidationException.Reason.MALFORMED_PAYLOAD,
                    "expected an object but got " + payload.getNodeType());
        }

        String status = text(payload, "status");
        if (FAILED_STATUS.equalsIgnoreCase(status)) {
            String error = text(payload, "error");
            throw error != null
                    ? new ValidationException(ValidationException.Reason.ANALYSIS_FAILED, error)
                    : new ValidationException(ValidationException.Reason.ANALYSIS_FAILED);
        }

        if (payload.has("analyses")) {
            JsonNode analyses = payload.get("analyses");
            if (analyses.isObject()) {
                return analyses;
            }
            if (analyses.isNull()) {
                return JsonNodeFactory.instance.objectNode();
            }
            throw new ValidationException(ValidationException.Reason.MALFORMED_PAYLOAD,
                    "analyses must be an object");
        }

        // An envelope without analyses carries no runner data
        return status != null ? JsonNodeFactory.instance.objectNode() : payload;
    }

    private RunnerAnalysis ingestRunner(String runnerId, JsonNode entry, Degradations degradations) {
        if (entry == null || entry.isNull() || entry.isMissingNode()) {
            degradations.add(DegradationType.RUNNER_MISSING, "no analysis supplied");
            return RunnerAnalysis.absent(runnerId);
        }
        if (!entry.isObject()) {
            degradations.add(DegradationType.ANALYSIS_FAILED, "analysis is not an object");
            return RunnerAnalysis.absent(runnerId);
        }
        if (entry.hasNonNull("error") && !entry.has(FATIGUE_SECTION) && !entry.has(COURSE_SECTION)) {
            degradations.add(DegradationType.ANALYSIS_FAILED, text(entry, "error"));
            return RunnerAnalysis.absent(runnerId);
        }

        try {
            FatigueAnalysis fatigue = ingestFatigue(entry.get(FATIGUE_SECTION), degradations);
            CourseAnalysis course = ingestCourse(entry.get(COURSE_SECTION), degradations);
            RestData restData = ingestRestData(firstPresent(entry, "rest_periods", "rest_events"), degradations);
            Recommendations recommendations = ingestRecommendations(entry.get("recommendations"));
            return new RunnerAnalysis(runnerId, fatigue, course, restData, recommendations, true);
        } catch (RuntimeException e) {
            log.warn("Failed to ingest analysis: runnerId={}", runnerId, e);
            degradations.add(DegradationType.ANALYSIS_FAILED, e.getMessage());
            return RunnerAnalysis.absent(runnerId);
        }
    }

    // ==================== FATIGUE ====================

    private FatigueAnalysis ingestFatigue(JsonNode node, Degradations degradations) {
        if (!isObject(node)) {
            degradations.add(DegradationType.FATIGUE_MISSING, "no fatigue_analysis section");
            return FatigueAnalysis.absent();
        }
        if (node.hasNonNull("error")) {
            degradations.add(DegradationType.FATIGUE_MISSING, text(node, "error"));
            return FatigueAnalysis.absent();
        }

        List<FatiguePoint> progression = new ArrayList<>();
        JsonNode points = node.get("fatigue_progression");
        if (points != null && points.isArray()) {
            for (JsonNode point : points) {
                Double mile = number(point, "mile");
                Double factor = number(point, "fatigue_factor");
                if (mile == null || factor == null) {
                    log.debug("Skipping fatigue point without mile or factor: runnerId={}", degradations.runnerId);
                    continue;
                }
                progression.add(new FatiguePoint(mile, factor, number(point, "terrain_difficulty")));
            }
        }

        return new FatigueAnalysis(
                number(node, "average_fatigue"),
                number(node, "peak_fatigue_mile"),
                progression
        );
    }

    // ==================== COURSE ====================

    private CourseAnalysis ingestCourse(JsonNode node, Degradations degradations) {
        if (!isObject(node)) {
            degradations.add(DegradationType.COURSE_MISSING, "no course_analysis section");
            return CourseAnalysis.absent();
        }

        List<SegmentPerformance> segments = new ArrayList<>();
        JsonNode items = node.get("segment_analysis");
        if (items != null && items.isArray()) {
            int index = 0;
            for (JsonNode item : items) {
                ingestSegment(item, index++, degradations).ifPresent(segments::add);
            }
        }

        return new CourseAnalysis(
                text(node, "strongest_terrain"),
                text(node, "weakest_terrain"),
                text(node, "elevation_tolerance"),
                segments
        );
    }

    private Optional<SegmentPerformance> ingestSegment(JsonNode node, int index, Degradations degradations) {
        String name = text(node, "segment_name");
        if (name == null) {
            degradations.add(DegradationType.SEGMENT_DROPPED, "segment #" + index + " has no name");
            return Optional.empty();
        }

        double difficulty = clamp(orZero(number(node, "difficulty_rating")), SegmentPerformance.MAX_DIFFICULTY,
                name, "difficulty_rating", degradations);
        double score = clamp(orZero(number(node, "performance_score")), 1.0,
                name, "performance_score", degradations);
        double gain = orZero(firstNumber(node, "elevation_gain_feet", "elevation_gain"));
        double loss = orZero(firstNumber(node, "elevation_loss_feet", "elevation_loss"));
        Double net = firstNumber(node, "net_elevation_change_feet", "net_elevation_change");

        return Optional.of(new SegmentPerformance(
                name,
                orZero(number(node, "start_mile")),
                orZero(number(node, "end_mile")),
                text(node, "terrain_type"),
                difficulty,
                Math.max(0.0, orZero(number(node, "average_pace"))),
                score,
                gain,
                loss,
                net != null ? net : gain - loss
        ));
    }

    private double clamp(double value, double max, String segment, String field, Degradations degradations) {
        if (value < 0.0 || value > max) {
            double clamped = Math.min(Math.max(value, 0.0), max);
            degradations.add(DegradationType.VALUE_CLAMPED,
                    field + " " + value + " of segment '" + segment + "' clamped to " + clamped);
            return clamped;
        }
        return value;
    }

    // ==================== REST DATA ====================

    private RestData ingestRestData(JsonNode node, Degradations degradations) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            degradations.add(DegradationType.REST_DATA_MISSING, "no rest_periods section");
            return RestData.absent();
        }

        if (node.isArray()) {
            return RestData.ofSequence(ingestRestEvents(node, degradations));
        }

        if (node.isObject()) {
            JsonNode events = firstPresent(node, "rest_periods", "rest_events");
            List<RestEvent> restEvents = List.of();
            if (events != null && events.isArray()) {
                restEvents = ingestRestEvents(events, degradations);
            } else if (events != null && !events.isNull()) {
                degradations.add(DegradationType.REST_DATA_MALFORMED, "rest_periods is not a sequence");
            }
            return RestData.bundled(
                    restEvents,
                    ingestStops(node.get("aid_station_stops")),
                    ingestPatterns(node.get("aid_station_patterns"))
            );
        }

        degradations.add(DegradationType.REST_DATA_MALFORMED, "unexpected rest data type " + node.getNodeType());
        return RestData.absent();
    }

    private List<RestEvent> ingestRestEvents(JsonNode items, Degradations degradations) {
        List<RestEvent> events = new ArrayList<>();
        int index = 0;
        for (JsonNode item : items) {
            int position = index++;
            if (!item.isObject()) {
                degradations.add(DegradationType.REST_DATA_MALFORMED, "rest event #" + position + " is not an object");
                continue;
            }
            RestEvent event = ingestRestEvent(item);
            if (!event.hasMile()) {
                degradations.add(DegradationType.REST_EVENT_DROPPED, "rest event #" + position + " has no usable mile");
            }
            events.add(event);
        }
        return events;
    }

    private RestEvent ingestRestEvent(JsonNode node) {
        String detailedType = text(node, "rest_type");
        return RestEvent.builder()
                // a zero mile counts as absent and falls through to start_mile
                .mile(firstPositive(node, "mile", "start_mile"))
                .nearbyAidStation(text(node, "nearby_aid_station"))
                .sleepStation(node.path("is_sleep_station").asBoolean(false))
                .detailedType(detailedType)
                .restType(RestType.fromDetailedType(detailedType))
                .estimatedRestMinutes(orZero(firstPositive(node, "estimated_rest_minutes", "duration_minutes")))
                .paceRatio(orZero(number(node, "pace_ratio")))
                .restPace(orZero(firstPositive(node, "pace_during", "actual_pace")))
                .paceBefore(number(node, "pace_before"))
                .confidence(Confidence.fromWire(text(node, "confidence")))
                .likelyReason(text(node, "likely_reason"))
                .aidStationDistance(number(node, "aid_station_distance"))
                .aidServices(strings(node.get("aid_services")))
                .build();
    }

    private List<AidStationStop> ingestStops(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<AidStationStop> stops = new ArrayList<>();
        for (JsonNode stop : node) {
            if (!stop.isObject()) {
                continue;
            }
            stops.add(new AidStationStop(
                    text(stop, "station_name"),
                    orZero(number(stop, "mile")),
                    orZero(number(stop, "rest_duration_minutes")),
                    stop.path("is_sleep_station").asBoolean(false),
                    stop.path("is_crew_station").asBoolean(false),
                    text(stop, "rest_type")
            ));
        }
        return stops;
    }

    private AidStationPatterns ingestPatterns(JsonNode node) {
        if (!isObject(node) || node.isEmpty()) {
            return null;
        }
        return new AidStationPatterns(
                node.path("total_aid_station_stops").asInt(0),
                node.path("sleep_station_usage").asInt(0),
                node.path("crew_rest_usage").asInt(0),
                text(node, "longest_rest_station"),
                orZero(number(node, "longest_rest_duration")),
                text(node, "rest_strategy")
        );
    }

    // ==================== RECOMMENDATIONS ====================

    private Recommendations ingestRecommendations(JsonNode node) {
        if (!isObject(node)) {
            return Recommendations.absent();
        }

        List<Recommendations.SegmentRecommendation> segments = new ArrayList<>();
        JsonNode items = node.get("segment_recommendations");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                if (!item.isObject()) {
                    continue;
                }
                segments.add(new Recommendations.SegmentRecommendation(
                        text(item, "segment"),
                        text(item, "terrain"),
                        orZero(number(item, "difficulty")),
                        orZero(number(item, "recommended_effort")),
                        text(item, "key_strategy")
                ));
            }
        }

        return new Recommendations(
                text(node, "overall_strategy"),
                segments,
                strings(node.get("critical_segments"))
        );
    }

    // ==================== FIELD ACCESS ====================

    private static boolean isObject(JsonNode node) {
        return node != null && node.isObject();
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        double parsed;
        if (value.isNumber()) {
            parsed = value.asDouble();
        } else if (value.isTextual()) {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }

    private static Double firstNumber(JsonNode node, String... fields) {
        for (String field : fields) {
            Double value = number(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Double firstPositive(JsonNode node, String... fields) {
        for (String field : fields) {
            Double value = number(node, field);
            if (value != null && value > 0.0) {
                return value;
            }
        }
        return null;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    /**
     * Collects warnings for a single runner.
     */
    private static final class Degradations {
        private final String runnerId;
        private final List<PartialDataWarning> sink;

        Degradations(String runnerId, List<PartialDataWarning> sink) {
            this.runnerId = runnerId;
            this.sink = sink;
        }

        void add(DegradationType type, String detail) {
            log.warn("Partial data: runnerId={}, type={}, detail={}", runnerId, type, detail);
            sink.add(new PartialDataWarning(runnerId, type, detail));
        }
    }
}
