package me.golemcore.pipeline.domain.exception;

/**
 * Required external-service configuration is missing. Fatal and never retried.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }
}
