package space.ketterling.geoanalysis.plan;

import space.ketterling.geoanalysis.AnalysisException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a raw plan is malformed. Lists every offending field.
 */
public final class PlanValidationException extends AnalysisException {
    private final List<FieldError> fieldErrors;

    public PlanValidationException(List<FieldError> fieldErrors) {
        super("validation_error", formatMessage(fieldErrors));
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public static PlanValidationException of(String field, String message) {
        return new PlanValidationException(List.of(new FieldError(field, message)));
    }

    public List<FieldError> fieldErrors() {
        return fieldErrors;
    }

    private static String formatMessage(List<FieldError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("at least one field error is required");
        }
        return "Invalid analysis plan: " + errors.stream()
                .map(e -> e.field() + ": " + e.message())
                .collect(Collectors.joining("; "));
    }

    /**
     * One rejected field, addressed by a dotted path such as {@code timeRange.start}.
     */
    public record FieldError(String field, String message) {
    }
}
