package fr.lapetina.ultra.comparison.domain.model;

/**
 * Recoverable per-runner data faults. Each is absorbed into a sentinel value rather than
 * failing the comparison.
 */
public enum DegradationType {
    /** Selected runner has no entry in the analysis map */
    RUNNER_MISSING,

    /** Producer marked this runner's analysis as failed, or the entry is unreadable */
    ANALYSIS_FAILED,

    /** No fatigue_analysis section */
    FATIGUE_MISSING,

    /** No course_analysis section */
    COURSE_MISSING,

    /** No rest section */
    REST_DATA_MISSING,

    /** Rest section or one of its events has an unexpected shape */
    REST_DATA_MALFORMED,

    /** Rest event without a usable mile; kept for counting, excluded from clustering */
    REST_EVENT_DROPPED,

    /** Segment without a name */
    SEGMENT_DROPPED,

    /** Difficulty rating or performance score outside its range */
    VALUE_CLAMPED
}
