package me.golemcore.pipeline.domain.exception;

import java.util.List;

/**
 * Malformed or out-of-range structured output. Retried within the same
 * attempt budget as transient failures.
 */
public class InsightValidationException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public InsightValidationException(List<String> violations) {
        super("Invalid insight: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InsightValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
