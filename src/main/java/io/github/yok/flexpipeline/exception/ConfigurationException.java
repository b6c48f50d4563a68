package io.github.yok.flexpipeline.exception;

/**
 * Thrown when the transformations configuration is missing, incomplete or inconsistent. Raised
 * before any stage runs.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
