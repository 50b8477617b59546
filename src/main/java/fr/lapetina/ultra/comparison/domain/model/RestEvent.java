package fr.lapetina.ultra.comparison.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A detected interval where a runner's pace indicates a stop or significant slowdown.
 * Immutable; all producer-side fallback field names are already resolved.
 *
 * <p>{@code mile} is null when the producer supplied neither a usable {@code mile} nor
 * {@code start_mile}; such events count towards a runner's rest total but cannot be
 * clustered.
 */
public record RestEvent(
        Double mile,
        String nearbyAidStation,
        boolean sleepStation,
        RestType restType,
        String detailedType,
        double estimatedRestMinutes,
        double paceRatio,
        double restPace,
        Double paceBefore,
        Confidence confidence,
        String likelyReason,
        Double aidStationDistance,
        List<String> aidServices
) implements ClusterEntry {

    /** Aid-station identity used when the producer did not name a nearby station. */
    public static final String UNKNOWN_AID_STATION = "Unknown";

    public RestEvent {
        if (nearbyAidStation != null && nearbyAidStation.isBlank()) {
            nearbyAidStation = null;
        }
        if (restType == null) {
            restType = RestType.fromDetailedType(detailedType);
        }
        if (confidence == null) {
            confidence = Confidence.LOW;
        }
        estimatedRestMinutes = Math.max(0.0, estimatedRestMinutes);
        paceRatio = Math.max(0.0, paceRatio);
        restPace = Math.max(0.0, restPace);
        aidServices = aidServices != null ? List.copyOf(aidServices) : List.of();
    }

    /**
     * Returns true when the event carries a resolvable mile marker.
     */
    public boolean hasMile() {
        return mile != null;
    }

    /**
     * Returns the aid-station identity used for clustering.
     */
    public String aidStationIdentity() {
        return nearbyAidStation != null ? nearbyAidStation : UNKNOWN_AID_STATION;
    }

    @Override
    @JsonIgnore
    public boolean isPlaceholder() {
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Double mile;
        private String nearbyAidStation;
        private boolean sleepStation;
        private RestType restType;
        private String detailedType;
        private double estimatedRestMinutes;
        private double paceRatio;
        private double restPace;
        private Double paceBefore;
        private Confidence confidence;
        private String likelyReason;
        private Double aidStationDistance;
        private List<String> aidServices;

        public Builder mile(Double mile) {
            this.mile = mile;
            return this;
        }

        public Builder nearbyAidStation(String nearbyAidStation) {
            this.nearbyAidStation = nearbyAidStation;
            return this;
        }

        public Builder sleepStation(boolean sleepStation) {
            this.sleepStation = sleepStation;
            return this;
        }

        public Builder restType(RestType restType) {
            this.restType = restType;
            return this;
        }

        public Builder detailedType(String detailedType) {
            this.detailedType = detailedType;
            return this;
        }

        public Builder estimatedRestMinutes(double estimatedRestMinutes) {
            this.estimatedRestMinutes = estimatedRestMinutes;
            return this;
        }

        public Builder paceRatio(double paceRatio) {
            this.paceRatio = paceRatio;
            return this;
        }

        public Builder restPace(double restPace) {
            this.restPace = restPace;
            return this;
        }

        public Builder paceBefore(Double paceBefore) {
            this.paceBefore = paceBefore;
            return this;
        }

        public Builder confidence(Confidence confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder likelyReason(String likelyReason) {
            this.likelyReason = likelyReason;
            return this;
        }

        public Builder aidStationDistance(Double aidStationDistance) {
            this.aidStationDistance = aidStationDistance;
            return this;
        }

        public Builder aidServices(List<String> aidServices) {
            this.aidServices = aidServices;
            return this;
        }

        public RestEvent build() {
            return new RestEvent(
                    mile, nearbyAidStation, sleepStation, restType, detailedType,
                    estimatedRestMinutes, paceRatio, restPace, paceBefore, confidence,
                    likelyReason, aidStationDistance, aidServices
            );
        }
    }
}
