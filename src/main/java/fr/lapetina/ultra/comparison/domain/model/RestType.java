package fr.lapetina.ultra.comparison.domain.model;

import java.util.Set;

/**
 * Coarse category of a rest event.
 * The analytics producer reports detailed types ({@code crew_sleep}, {@code drop_bag_stop}, ...)
 * which collapse onto these four values.
 */
public enum RestType {
    /** Crew-assisted stop (crew support, crew sleep, crew resupply) */
    CREW,

    /** Medical check or treatment */
    MEDICAL,

    /** Drop bag, aid or gear stop */
    RESUPPLY,

    /** Anything else, including solo sleep and quick stops */
    OTHER;

    private static final Set<String> RESUPPLY_TYPES = Set.of(
            "resupply", "drop_bag_stop", "aid_stop", "gear_check"
    );

    public static RestType fromDetailedType(String detailedType) {
        if (detailedType == null || detailedType.isBlank()) {
            return OTHER;
        }
        String type = detailedType.trim().toLowerCase();
        if (type.startsWith("crew")) {
            return CREW;
        }
        if (type.equals("medical")) {
            return MEDICAL;
        }
        if (RESUPPLY_TYPES.contains(type)) {
            return RESUPPLY;
        }
        return OTHER;
    }
}
