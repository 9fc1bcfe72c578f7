package space.ketterling.geoanalysis.guardrail;

import space.ketterling.geoanalysis.AnalysisException;

import java.util.List;

/**
 * Thrown by {@link GuardrailEngine#enforce} when a plan exceeds policy limits.
 */
public final class GuardrailViolationException extends AnalysisException {
    private final List<String> warnings;

    public GuardrailViolationException(String message, List<String> warnings) {
        super("guardrail_violation", message);
        this.warnings = List.copyOf(warnings);
    }

    public List<String> warnings() {
        return warnings;
    }
}
