package me.golemcore.pipeline.domain.exception;

/**
 * Base of generation failures raised while turning a signal into an insight.
 */
public abstract class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
