package space.ketterling.geoanalysis;

import java.util.Objects;

/**
 * Base failure for the analysis pipeline.
 *
 * <p>
 * Every subclass carries a stable error code that the HTTP layer returns next
 * to the user-facing message.
 * </p>
 */
public abstract class AnalysisException extends RuntimeException {
    private final String errorCode;

    protected AnalysisException(String errorCode, String message) {
        super(Objects.requireNonNull(message, "message"));
        this.errorCode = requireCode(errorCode);
    }

    protected AnalysisException(String errorCode, String message, Throwable cause) {
        super(Objects.requireNonNull(message, "message"), cause);
        this.errorCode = requireCode(errorCode);
    }

    /**
     * Stable machine-readable code, e.g. {@code validation_error}.
     */
    public String errorCode() {
        return errorCode;
    }

    private static String requireCode(String code) {
        Objects.requireNonNull(code, "errorCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("errorCode must be non-blank");
        }
        return code;
    }
}
