package space.ketterling.geoanalysis.guardrail;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a guardrail evaluation. Warnings never make a plan invalid.
 */
public record GuardrailResult(boolean valid, String error, List<String> warnings) {

    public GuardrailResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (valid && error != null)
            throw new IllegalArgumentException("a valid result carries no error");
        if (!valid && (error == null || error.isBlank()))
            throw new IllegalArgumentException("an invalid result needs an error message");
    }

    public Optional<String> errorOpt() {
        return Optional.ofNullable(error);
    }
}
