package me.golemcore.pipeline.domain.exception;

/**
 * Authentication failure, invalid request or filtered content. Never retried.
 */
public class NonRetryableAnalysisException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public NonRetryableAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
