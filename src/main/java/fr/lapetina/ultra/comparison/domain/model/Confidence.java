package fr.lapetina.ultra.comparison.domain.model;

/**
 * Certainty attached to a detected rest event.
 * Tiers form a strict total order: HIGH > MEDIUM > LOW.
 */
public enum Confidence {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int rank;

    Confidence(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Parses the producer's lowercase tier name. Absent or unrecognised values map to the
     * lowest tier.
     */
    public static Confidence fromWire(String value) {
        if (value == null) {
            return LOW;
        }
        return switch (value.trim().toLowerCase()) {
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            default -> LOW;
        };
    }
}
