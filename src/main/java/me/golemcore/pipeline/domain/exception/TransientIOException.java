package me.golemcore.pipeline.domain.exception;

/**
 * Network failure, timeout or upstream rate limit. Retried.
 */
public class TransientIOException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
