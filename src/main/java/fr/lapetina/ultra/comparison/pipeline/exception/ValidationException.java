package fr.lapetina.ultra.comparison.pipeline.exception;

/**
 * Fatal request-level error: the whole comparison is rejected.
 *
 * This occurs when:
 * - The upstream payload is marked as failed
 * - No runners are selected
 * - The payload is not a JSON object
 */
public final class ValidationException extends RuntimeException {

    private final Reason reason;

    public ValidationException(Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public ValidationException(Reason reason, String details) {
        super(reason.getMessage() + ": " + details);
        this.reason = reason;
    }

    public ValidationException(Reason reason, String details, Throwable cause) {
        super(reason.getMessage() + ": " + details, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        ANALYSIS_FAILED("Analysis failed"),
        NO_RUNNERS_SELECTED("No runners selected"),
        MALFORMED_PAYLOAD("Analysis payload is malformed");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
